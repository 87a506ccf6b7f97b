package com.apogee.auth.config;

import com.apogee.auth.enums.OtpPurpose;
import com.apogee.auth.enums.RateLimitScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Security configuration properties for the Authentication Service.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "security")
public class SecurityProperties {

    private Jwt jwt = new Jwt();
    private Password password = new Password();
    private Mfa mfa = new Mfa();
    private Otp otp = new Otp();
    private ResetToken resetToken = new ResetToken();
    private RateLimit rateLimit = new RateLimit();
    @Valid
    private Verification verification = new Verification();
    private Cors cors = new Cors();

    @Data
    public static class Jwt {
        private String secret;
        private Long accessTokenExpiration = 900000L; // 15 minutes
        private Long refreshTokenExpiration = 604800000L; // 7 days
        private String issuer = "https://auth.apogee.app";
        private Long refreshHintThresholdSeconds = 60L;
    }

    @Data
    public static class Password {
        private Integer bcryptStrength = 12;
        private Policy policy = new Policy();

        @Data
        public static class Policy {
            private Integer minLength = 8;
            private Integer maxLength = 128;
            private Boolean requireUppercase = true;
            private Boolean requireLowercase = false;
            private Boolean requireDigit = true;
            private Boolean requireSpecial = true;
        }
    }

    @Data
    public static class Mfa {
        private Duration challengeTtl = Duration.ofMinutes(10);
        private Duration stepUpWindow = Duration.ofMinutes(5);
    }

    @Data
    public static class Otp {
        private Duration codeTtl = Duration.ofMinutes(10);
        private Duration retention = Duration.ofDays(30);
        private Map<OtpPurpose, Duration> freshness = defaultFreshness();

        public Duration freshnessFor(OtpPurpose purpose) {
            return freshness.getOrDefault(purpose, Duration.ofMinutes(10));
        }

        private static Map<OtpPurpose, Duration> defaultFreshness() {
            Map<OtpPurpose, Duration> windows = new EnumMap<>(OtpPurpose.class);
            windows.put(OtpPurpose.SIGNUP, Duration.ofMinutes(30));
            windows.put(OtpPurpose.PHONE_VERIFY, Duration.ofMinutes(30));
            windows.put(OtpPurpose.SIGNIN, Duration.ofMinutes(10));
            windows.put(OtpPurpose.MFA, Duration.ofMinutes(5));
            windows.put(OtpPurpose.PASSWORD_RESET, Duration.ofMinutes(10));
            return windows;
        }
    }

    @Data
    public static class ResetToken {
        private Duration ttl = Duration.ofMinutes(10);
    }

    @Data
    public static class RateLimit {
        private Integer maxAttempts = 5;
        private Duration window = Duration.ofMinutes(15);
        private Duration sweepInterval = Duration.ofMinutes(5);
        private Map<RateLimitScope, Limit> scopes = new EnumMap<>(RateLimitScope.class);

        public Limit limitFor(RateLimitScope scope) {
            Limit override = scopes.get(scope);
            Limit limit = new Limit();
            limit.setMaxAttempts(override != null && override.getMaxAttempts() != null
                    ? override.getMaxAttempts() : maxAttempts);
            limit.setWindow(override != null && override.getWindow() != null
                    ? override.getWindow() : window);
            return limit;
        }

        @Data
        public static class Limit {
            private Integer maxAttempts;
            private Duration window;
        }
    }

    @Data
    public static class Verification {
        /**
         * "twilio" in deployed environments. "logging" is only honoured under the dev and test profiles.
         * There is no default: startup fails until one is chosen.
         */
        @NotBlank(message = "security.verification.provider must be set to twilio or logging")
        @Pattern(regexp = "twilio|logging", message = "security.verification.provider must be twilio or logging")
        private String provider;
        private String developmentCode;
        private Twilio twilio = new Twilio();

        @Data
        public static class Twilio {
            private String accountSid;
            private String authToken;
            private String verifyServiceSid;
        }
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:8081"));
    }
}
