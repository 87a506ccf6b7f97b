package com.apogee.auth.integration;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.util.MaskingUtil;
import com.twilio.Twilio;
import com.twilio.exception.ApiException;
import com.twilio.rest.verify.v2.service.Verification;
import com.twilio.rest.verify.v2.service.VerificationCheck;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Twilio Verify v2 adapter.
 * <p>
 * Client errors (4xx) are rejections; connection faults and 5xx responses are retried, and once retries or
 * the circuit breaker give up the fallback reports the provider as unavailable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "security.verification.provider", havingValue = "twilio")
public class TwilioVerificationProvider implements VerificationProvider {

    private static final String APPROVED = "approved";

    private final SecurityProperties securityProperties;

    @PostConstruct
    public void init() {
        SecurityProperties.Verification.Twilio twilio = securityProperties.getVerification().getTwilio();
        if (!StringUtils.hasText(twilio.getAccountSid()) || !StringUtils.hasText(twilio.getAuthToken())
                || !StringUtils.hasText(twilio.getVerifyServiceSid())) {
            throw new IllegalStateException("Twilio verification requires account-sid, auth-token and verify-service-sid");
        }
        Twilio.init(twilio.getAccountSid(), twilio.getAuthToken());
        log.info("Twilio Verify provider initialized");
    }

    @Override
    @CircuitBreaker(name = "verificationProvider", fallbackMethod = "sendFallback")
    @Retry(name = "verificationProvider")
    public ProviderSendResult send(String destination, String channel) {
        try {
            Verification verification = Verification.creator(serviceSid(), destination, channel).create();
            log.info("Dispatched {} code to {} ({})", channel, MaskingUtil.maskDestination(destination),
                    verification.getSid());
            return ProviderSendResult.sent(verification.getSid());
        } catch (ApiException e) {
            if (isClientError(e)) {
                log.warn("Twilio rejected dispatch to {}: {}", MaskingUtil.maskDestination(destination), e.getMessage());
                return ProviderSendResult.rejected(e.getMessage());
            }
            throw e;
        }
    }

    @Override
    @CircuitBreaker(name = "verificationProvider", fallbackMethod = "checkFallback")
    @Retry(name = "verificationProvider")
    public ProviderCheckResult check(String destination, String code) {
        try {
            VerificationCheck check = VerificationCheck.creator(serviceSid())
                    .setTo(destination)
                    .setCode(code)
                    .create();
            if (APPROVED.equals(check.getStatus())) {
                return ProviderCheckResult.approved();
            }
            return ProviderCheckResult.rejected("Verification status " + check.getStatus());
        } catch (ApiException e) {
            if (isClientError(e)) {
                // 404 once the verification expired or was already approved, 429 after too many checks
                log.warn("Twilio rejected check for {}: {}", MaskingUtil.maskDestination(destination), e.getMessage());
                return ProviderCheckResult.rejected(e.getMessage());
            }
            throw e;
        }
    }

    private ProviderSendResult sendFallback(String destination, String channel, Throwable t) {
        log.error("Verification provider unavailable for {} dispatch: {}", channel, t.getMessage());
        return ProviderSendResult.unavailable(t.getMessage());
    }

    private ProviderCheckResult checkFallback(String destination, String code, Throwable t) {
        log.error("Verification provider unavailable for code check: {}", t.getMessage());
        return ProviderCheckResult.unavailable(t.getMessage());
    }

    private String serviceSid() {
        return securityProperties.getVerification().getTwilio().getVerifyServiceSid();
    }

    private static boolean isClientError(ApiException e) {
        Integer status = e.getStatusCode();
        return status != null && status >= 400 && status < 500;
    }
}
