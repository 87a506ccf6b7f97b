package com.apogee.auth.service;

import com.apogee.auth.entity.AuditLog;
import com.apogee.auth.enums.AuditEventType;
import com.apogee.auth.repository.AuditLogRepository;
import com.apogee.auth.support.MutableClock;
import com.apogee.auth.util.ClientInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableAsync;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuditServiceTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private final AuditLogRepository auditLogRepository = mock(AuditLogRepository.class);

    @Test
    void eventIsRecordedWithClientAndMetadata() {
        AuditService auditService = new AuditService(auditLogRepository, new ObjectMapper(), clock);
        UUID accountId = UUID.randomUUID();
        ClientInfo client = ClientInfo.builder().ipAddress("203.0.113.7").userAgent("ios/2.1").build();

        auditService.logAuthenticationEvent(accountId, AuditEventType.SIGN_IN, true, client, Map.of("method", "otp"));

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        AuditLog saved = captor.getValue();
        assertThat(saved.getAccountId()).isEqualTo(accountId);
        assertThat(saved.getEventType()).isEqualTo(AuditEventType.SIGN_IN);
        assertThat(saved.getEventTime()).isEqualTo(clock.instant());
        assertThat(saved.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(saved.getUserAgent()).isEqualTo("ios/2.1");
        assertThat(saved.getMetadata()).isEqualTo("{\"method\":\"otp\"}");
    }

    @Test
    void missingClientIsRecordedAsUnknown() {
        AuditService auditService = new AuditService(auditLogRepository, new ObjectMapper(), clock);

        auditService.logAuthenticationEvent(null, AuditEventType.SIGN_IN_FAILED, false, null);

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        assertThat(captor.getValue().getIpAddress()).isEqualTo("unknown");
        assertThat(captor.getValue().getMetadata()).isNull();
    }

    @Test
    void bothOverloadsWriteOffTheCallingThread() {
        new ApplicationContextRunner()
                .withUserConfiguration(AsyncAuditConfiguration.class)
                .withBean(AuditLogRepository.class, () -> auditLogRepository)
                .withBean(Clock.class, () -> clock)
                .run(context -> {
                    AuditService auditService = context.getBean(AuditService.class);

                    assertThat(writerThread(() -> auditService.logAuthenticationEvent(UUID.randomUUID(),
                            AuditEventType.LOGOUT, true, ClientInfo.unknown())))
                            .isNotEqualTo(Thread.currentThread().getName());
                    assertThat(writerThread(() -> auditService.logAuthenticationEvent(UUID.randomUUID(),
                            AuditEventType.LOGOUT, true, ClientInfo.unknown(), Map.of("reason", "user"))))
                            .isNotEqualTo(Thread.currentThread().getName());
                });
    }

    private String writerThread(Runnable call) throws InterruptedException {
        CountDownLatch saved = new CountDownLatch(1);
        AtomicReference<String> thread = new AtomicReference<>();
        when(auditLogRepository.save(any(AuditLog.class))).thenAnswer(invocation -> {
            thread.set(Thread.currentThread().getName());
            saved.countDown();
            return invocation.getArgument(0);
        });

        call.run();

        assertThat(saved.await(5, TimeUnit.SECONDS)).isTrue();
        return thread.get();
    }

    @Configuration
    @EnableAsync
    @Import(AuditService.class)
    static class AsyncAuditConfiguration {

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }
}
