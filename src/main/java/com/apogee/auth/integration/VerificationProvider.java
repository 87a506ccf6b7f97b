package com.apogee.auth.integration;

/**
 * External service that delivers one-time codes and checks them.
 * <p>
 * Implementations report every outcome as a result value and must not throw for provider-side failures.
 */
public interface VerificationProvider {

    /**
     * Dispatch a code to a phone number or email address over the given channel ("sms" or "email").
     */
    ProviderSendResult send(String destination, String channel);

    /**
     * Check a submitted code for the destination's most recent dispatch.
     */
    ProviderCheckResult check(String destination, String code);
}
