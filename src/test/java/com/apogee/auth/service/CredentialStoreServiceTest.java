package com.apogee.auth.service;

import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.enums.MfaState;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.repository.AccountRepository;
import com.apogee.auth.support.MutableClock;
import com.apogee.auth.support.TestAccounts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class CredentialStoreServiceTest {

    @Autowired AccountRepository accountRepository;

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private CredentialStoreService credentialStore;
    private UUID accountId;

    @BeforeEach
    void setUp() {
        credentialStore = new CredentialStoreService(accountRepository, clock);
        accountId = accountRepository.saveAndFlush(TestAccounts.verified().build()).getId();
    }

    @AfterEach
    void tearDown() {
        accountRepository.deleteAll();
    }

    @Test
    void concurrentRotationsOfTheSameValueHaveExactlyOneWinner() throws Exception {
        Instant issuedAt = clock.instant();
        credentialStore.storeRefresh(accountId, "r1", issuedAt, issuedAt.plus(Duration.ofDays(7)));

        int threads = 2;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ErrorKind>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String next = "r2-" + i;
                Callable<ErrorKind> task = () -> {
                    start.await();
                    try {
                        credentialStore.rotateRefresh(accountId, "r1", issuedAt, next, issuedAt.plus(Duration.ofDays(7)));
                        return null;
                    } catch (AuthenticationException e) {
                        return e.getKind();
                    }
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            List<ErrorKind> outcomes = new ArrayList<>();
            for (Future<ErrorKind> result : results) {
                outcomes.add(result.get(10, TimeUnit.SECONDS));
            }

            assertThat(outcomes).filteredOn(Objects::isNull).hasSize(1);
            assertThat(outcomes).contains(ErrorKind.ROTATION_CONFLICT);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rotatedValueCannotBeReplayed() {
        Instant issuedAt = clock.instant();
        credentialStore.storeRefresh(accountId, "r1", issuedAt, issuedAt.plus(Duration.ofDays(7)));
        credentialStore.rotateRefresh(accountId, "r1", issuedAt, "r2", issuedAt.plus(Duration.ofDays(7)));

        assertThatThrownBy(() -> credentialStore.rotateRefresh(accountId, "r1", issuedAt, "r3",
                issuedAt.plus(Duration.ofDays(7))))
                .extracting("kind").isEqualTo(ErrorKind.ROTATION_CONFLICT);
    }

    @Test
    void signInElsewhereIsReportedToTheOldDevice() {
        Instant firstSignIn = clock.instant();
        credentialStore.storeRefresh(accountId, "device-a", firstSignIn, firstSignIn.plus(Duration.ofDays(7)));

        clock.advance(Duration.ofMinutes(3));
        credentialStore.storeRefresh(accountId, "device-b", clock.instant(), clock.instant().plus(Duration.ofDays(7)));

        assertThatThrownBy(() -> credentialStore.rotateRefresh(accountId, "device-a", firstSignIn, "next",
                clock.instant().plus(Duration.ofDays(7))))
                .extracting("kind").isEqualTo(ErrorKind.SESSION_ENDED_ELSEWHERE);
    }

    @Test
    void expiredStoredValueIsReportedAsExpired() {
        Instant issuedAt = clock.instant();
        credentialStore.storeRefresh(accountId, "r1", issuedAt, issuedAt.plus(Duration.ofMinutes(1)));
        clock.advance(Duration.ofMinutes(2));

        assertThatThrownBy(() -> credentialStore.rotateRefresh(accountId, "r1", issuedAt, "r2",
                clock.instant().plus(Duration.ofDays(7))))
                .extracting("kind").isEqualTo(ErrorKind.EXPIRED_CREDENTIAL);
    }

    @Test
    void logoutRevokesEarlierAccessAndRefresh() {
        Instant issuedAt = clock.instant();
        credentialStore.storeRefresh(accountId, "r1", issuedAt, issuedAt.plus(Duration.ofDays(7)));
        clock.advance(Duration.ofMillis(5));

        Instant watermark = credentialStore.logout(accountId);

        assertThat(watermark).isEqualTo(clock.instant());
        assertThat(credentialStore.passesWatermark(accountId, issuedAt)).isFalse();
        assertThat(credentialStore.passesWatermark(accountId, watermark)).isTrue();
        assertThatThrownBy(() -> credentialStore.rotateRefresh(accountId, "r1", issuedAt, "r2",
                issuedAt.plus(Duration.ofDays(7))))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_CREDENTIAL);
    }

    @Test
    void rotationClearsTheWatermark() {
        Instant issuedAt = clock.instant();
        accountRepository.logout(accountId, MfaState.INVALIDATED, MfaState.sourcesOf(MfaState.INVALIDATED),
                issuedAt.plusSeconds(1));
        credentialStore.storeRefresh(accountId, "r1", issuedAt, issuedAt.plus(Duration.ofDays(7)));

        credentialStore.rotateRefresh(accountId, "r1", issuedAt, "r2", issuedAt.plus(Duration.ofDays(7)));

        assertThat(credentialStore.passesWatermark(accountId, issuedAt)).isTrue();
    }

    @Test
    void unknownAccountCannotRotate() {
        assertThatThrownBy(() -> credentialStore.rotateRefresh(UUID.randomUUID(), "r1", clock.instant(), "r2",
                clock.instant().plus(Duration.ofDays(7))))
                .extracting("kind").isEqualTo(ErrorKind.INVALID_CREDENTIAL);
    }

    @Test
    void watermarkLookupFailureAcceptsTheToken() {
        AccountRepository failing = mock(AccountRepository.class);
        when(failing.findTokenInvalidatedAt(any())).thenThrow(new DataAccessResourceFailureException("down"));

        CredentialStoreService degraded = new CredentialStoreService(failing, clock);

        assertThat(degraded.passesWatermark(accountId, clock.instant())).isTrue();
    }
}
