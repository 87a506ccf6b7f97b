package com.apogee.auth.service;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.enums.RateLimitScope;
import com.apogee.auth.exception.RateLimitedException;
import com.apogee.auth.support.MutableClock;
import com.apogee.auth.support.TestSecurityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimitingServiceTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private SecurityProperties properties;
    private RateLimitingService limiter;

    @BeforeEach
    void setUp() {
        properties = TestSecurityProperties.create();
        limiter = new RateLimitingService(properties, clock);
    }

    @Test
    void sixthAttemptInWindowIsDenied() {
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.admit(RateLimitScope.SIGN_IN, "10.0.0.1").isAllowed()).isTrue();
        }

        RateLimitDecision decision = limiter.admit(RateLimitScope.SIGN_IN, "10.0.0.1");

        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getRetryAfterSeconds()).isEqualTo(Duration.ofMinutes(15).toSeconds());
    }

    @Test
    void remainingCountsDown() {
        assertThat(limiter.admit(RateLimitScope.SIGN_IN, "a").getRemaining()).isEqualTo(4);
        assertThat(limiter.admit(RateLimitScope.SIGN_IN, "a").getRemaining()).isEqualTo(3);
    }

    @Test
    void retryAfterShrinksAndNeverDropsBelowOneSecond() {
        for (int i = 0; i < 5; i++) {
            limiter.admit(RateLimitScope.SIGN_IN, "a");
        }
        clock.advance(Duration.ofMinutes(15).minusMillis(200));

        assertThatThrownBy(() -> limiter.admitOrThrow(RateLimitScope.SIGN_IN, "a"))
                .isInstanceOf(RateLimitedException.class)
                .extracting("retryAfterSeconds").isEqualTo(1L);
    }

    @Test
    void scopesAndIdentitiesAreIndependent() {
        for (int i = 0; i < 6; i++) {
            limiter.admit(RateLimitScope.SIGN_IN, "a");
        }

        assertThat(limiter.admit(RateLimitScope.SIGN_IN, "b").isAllowed()).isTrue();
        assertThat(limiter.admit(RateLimitScope.OTP_VERIFY, "a").isAllowed()).isTrue();
    }

    @Test
    void windowExpiryStartsAFreshWindow() {
        for (int i = 0; i < 6; i++) {
            limiter.admit(RateLimitScope.SIGN_IN, "a");
        }
        clock.advance(Duration.ofMinutes(15));

        RateLimitDecision decision = limiter.admit(RateLimitScope.SIGN_IN, "a");

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.getRemaining()).isEqualTo(4);
    }

    @Test
    void successResetsTheWindow() {
        for (int i = 0; i < 5; i++) {
            limiter.admit(RateLimitScope.SIGN_IN, "a");
        }

        limiter.resetOnSuccess(RateLimitScope.SIGN_IN, "a");

        assertThat(limiter.admit(RateLimitScope.SIGN_IN, "a").isAllowed()).isTrue();
    }

    @Test
    void scopeOverrideReplacesOnlyTheFieldsItSets() {
        SecurityProperties.RateLimit.Limit override = new SecurityProperties.RateLimit.Limit();
        override.setMaxAttempts(2);
        properties.getRateLimit().getScopes().put(RateLimitScope.OTP_SEND, override);

        limiter.admit(RateLimitScope.OTP_SEND, "a");
        limiter.admit(RateLimitScope.OTP_SEND, "a");
        RateLimitDecision denied = limiter.admit(RateLimitScope.OTP_SEND, "a");

        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.getRetryAfterSeconds()).isEqualTo(Duration.ofMinutes(15).toSeconds());
    }

    @Test
    void sweepEvictsOnlyExpiredWindows() {
        limiter.admit(RateLimitScope.SIGN_IN, "old");
        clock.advance(Duration.ofMinutes(10));
        limiter.admit(RateLimitScope.SIGN_IN, "new");
        clock.advance(Duration.ofMinutes(6));

        int evicted = limiter.sweepExpiredWindows();

        assertThat(evicted).isEqualTo(1);
        assertThat(limiter.trackedWindows()).isEqualTo(1);
    }
}
