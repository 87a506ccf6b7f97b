package com.apogee.auth.integration;

import lombok.Value;

@Value
public class ProviderSendResult {

    public enum Outcome {
        SENT,
        REJECTED,
        UNAVAILABLE
    }

    Outcome outcome;
    String providerReference;
    String reason;

    public static ProviderSendResult sent(String providerReference) {
        return new ProviderSendResult(Outcome.SENT, providerReference, null);
    }

    public static ProviderSendResult rejected(String reason) {
        return new ProviderSendResult(Outcome.REJECTED, null, reason);
    }

    public static ProviderSendResult unavailable(String reason) {
        return new ProviderSendResult(Outcome.UNAVAILABLE, null, reason);
    }
}
