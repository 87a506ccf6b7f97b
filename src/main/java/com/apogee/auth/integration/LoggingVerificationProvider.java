package com.apogee.auth.integration;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.util.MaskingUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * Development provider: delivers nothing and accepts the configured development code.
 * Never created outside the dev and test profiles, and never without an explicit opt-in.
 */
@Slf4j
@Component
@Profile({"dev", "test"})
@RequiredArgsConstructor
@ConditionalOnProperty(name = "security.verification.provider", havingValue = "logging")
public class LoggingVerificationProvider implements VerificationProvider {

    private final SecurityProperties securityProperties;

    @Override
    public ProviderSendResult send(String destination, String channel) {
        String reference = "dev-" + UUID.randomUUID();
        log.info("[dev] would send {} code to {} ({})", channel, MaskingUtil.maskDestination(destination), reference);
        return ProviderSendResult.sent(reference);
    }

    @Override
    public ProviderCheckResult check(String destination, String code) {
        String expected = securityProperties.getVerification().getDevelopmentCode();
        if (StringUtils.hasText(expected) && expected.equals(code)) {
            return ProviderCheckResult.approved();
        }
        return ProviderCheckResult.rejected("Code does not match");
    }
}
