package com.apogee.auth.scheduler;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.service.AuditService;
import com.apogee.auth.service.OtpService;
import com.apogee.auth.service.RateLimitingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping: evicts stale rate-limit windows and prunes old ledger and audit rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecurityCleanupScheduler {

    private final RateLimitingService rateLimitingService;
    private final OtpService otpService;
    private final AuditService auditService;
    private final SecurityProperties securityProperties;

    @Value("${security.cleanup.audit-retention-days:90}")
    private int auditRetentionDays;

    @Scheduled(fixedDelayString = "${security.rate-limit.sweep-interval:PT5M}")
    public void sweepRateLimitWindows() {
        int evicted = rateLimitingService.sweepExpiredWindows();
        if (evicted > 0) {
            log.debug("Evicted {} expired rate-limit windows", evicted);
        }
    }

    @Scheduled(cron = "${security.cleanup.cron:0 30 3 * * *}")
    public void pruneHistory() {
        try {
            int ledgerRows = otpService.purgeOlderThan(securityProperties.getOtp().getRetention());
            int auditRows = auditService.cleanupOldLogs(auditRetentionDays);
            log.info("Pruned {} verification attempts and {} audit logs", ledgerRows, auditRows);
        } catch (RuntimeException e) {
            log.error("Error during security history cleanup", e);
        }
    }
}
