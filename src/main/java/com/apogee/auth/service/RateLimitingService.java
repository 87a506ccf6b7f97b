package com.apogee.auth.service;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.enums.RateLimitScope;
import com.apogee.auth.exception.RateLimitedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window attempt counter per scope and caller identity.
 * <p>
 * Windows live in process memory; the limiter protects against abuse and gives no cross-instance guarantee.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitingService {

    private final SecurityProperties securityProperties;
    private final Clock clock;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    /**
     * Count an attempt and report whether it may proceed.
     */
    public RateLimitDecision admit(RateLimitScope scope, String identity) {
        SecurityProperties.RateLimit.Limit limit = securityProperties.getRateLimit().limitFor(scope);
        Instant now = clock.instant();
        String key = key(scope, identity);

        Window window = windows.compute(key, (k, existing) -> {
            if (existing == null || existing.isOver(now, limit.getWindow())) {
                return new Window(now, 1);
            }
            return new Window(existing.start, existing.attempts + 1);
        });

        if (window.attempts > limit.getMaxAttempts()) {
            long retryAfter = retryAfterSeconds(window, limit.getWindow(), now);
            log.warn("Rate limit exceeded for {} ({} attempts), retry after {}s", key, window.attempts, retryAfter);
            return RateLimitDecision.denied(retryAfter);
        }

        return RateLimitDecision.allowed(limit.getMaxAttempts() - window.attempts);
    }

    /**
     * Count an attempt, throwing when the caller is over the limit.
     */
    public int admitOrThrow(RateLimitScope scope, String identity) {
        RateLimitDecision decision = admit(scope, identity);
        if (!decision.isAllowed()) {
            throw new RateLimitedException(decision.getRetryAfterSeconds());
        }
        return decision.getRemaining();
    }

    /**
     * Clear the caller's window after a successful attempt.
     */
    public void resetOnSuccess(RateLimitScope scope, String identity) {
        if (windows.remove(key(scope, identity)) != null) {
            log.debug("Reset rate limit window for {}:{}", scope, identity);
        }
    }

    /**
     * Evict windows whose start is older than their window length.
     *
     * @return number of evicted windows
     */
    public int sweepExpiredWindows() {
        Instant now = clock.instant();
        int before = windows.size();
        windows.entrySet().removeIf(entry -> {
            RateLimitScope scope = RateLimitScope.valueOf(entry.getKey().substring(0, entry.getKey().indexOf(':')));
            Duration length = securityProperties.getRateLimit().limitFor(scope).getWindow();
            return entry.getValue().isOver(now, length);
        });
        return Math.max(0, before - windows.size());
    }

    int trackedWindows() {
        return windows.size();
    }

    private long retryAfterSeconds(Window window, Duration length, Instant now) {
        long millis = Duration.between(now, window.start.plus(length)).toMillis();
        // rounded up, never below one second
        return Math.max(1L, (millis + 999) / 1000);
    }

    private static String key(RateLimitScope scope, String identity) {
        return scope.name() + ":" + (identity == null ? "unknown" : identity);
    }

    private static final class Window {
        private final Instant start;
        private final int attempts;

        private Window(Instant start, int attempts) {
            this.start = start;
            this.attempts = attempts;
        }

        private boolean isOver(Instant now, Duration length) {
            return !now.isBefore(start.plus(length));
        }
    }
}
