package com.apogee.auth.integration;

import lombok.Value;

@Value
public class ProviderCheckResult {

    public enum Outcome {
        APPROVED,
        REJECTED,
        UNAVAILABLE
    }

    Outcome outcome;
    String reason;

    public static ProviderCheckResult approved() {
        return new ProviderCheckResult(Outcome.APPROVED, null);
    }

    public static ProviderCheckResult rejected(String reason) {
        return new ProviderCheckResult(Outcome.REJECTED, reason);
    }

    public static ProviderCheckResult unavailable(String reason) {
        return new ProviderCheckResult(Outcome.UNAVAILABLE, reason);
    }
}
