package com.apogee.auth.service;

import com.apogee.auth.entity.AuditLog;
import com.apogee.auth.enums.AuditEventType;
import com.apogee.auth.repository.AuditLogRepository;
import com.apogee.auth.util.ClientInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;

/**
 * Asynchronous audit trail of authentication events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Log authentication event.
     */
    @Async
    @Transactional
    public void logAuthenticationEvent(UUID accountId, AuditEventType eventType, boolean success,
                                       ClientInfo client, Map<String, Object> metadata) {
        record(accountId, eventType, success, client, metadata);
    }

    // a self-call skips the async proxy, so this overload is async on its own
    @Async
    @Transactional
    public void logAuthenticationEvent(UUID accountId, AuditEventType eventType, boolean success, ClientInfo client) {
        record(accountId, eventType, success, client, null);
    }

    /**
     * Clean up old audit logs.
     */
    @Transactional
    public int cleanupOldLogs(int daysToKeep) {
        Instant cutoff = clock.instant().minus(daysToKeep, ChronoUnit.DAYS);
        int deleted = auditLogRepository.deleteOlderThan(cutoff);
        log.info("Deleted {} audit logs older than {} days", deleted, daysToKeep);
        return deleted;
    }

    private void record(UUID accountId, AuditEventType eventType, boolean success,
                        ClientInfo client, Map<String, Object> metadata) {
        log.debug("Logging authentication event: {} for account: {}", eventType, accountId);

        ClientInfo source = client != null ? client : ClientInfo.unknown();
        AuditLog auditLog = AuditLog.builder()
                .accountId(accountId)
                .eventType(eventType)
                .eventTime(clock.instant())
                .success(success)
                .ipAddress(source.getIpAddress())
                .userAgent(source.getUserAgent())
                .correlationId(source.getCorrelationId())
                .metadata(convertMetadataToJson(metadata))
                .build();

        auditLogRepository.save(auditLog);
    }

    private String convertMetadataToJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize audit metadata: {}", e.getMessage());
            return metadata.toString();
        }
    }
}
