package com.apogee.auth.support;

import com.apogee.auth.entity.Account;
import com.apogee.auth.enums.MfaMethod;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Account builders with every required column filled.
 */
public final class TestAccounts {

    private static final AtomicInteger SEQUENCE = new AtomicInteger(1000);

    private TestAccounts() {
    }

    public static Account.AccountBuilder verified() {
        int n = SEQUENCE.incrementAndGet();
        return Account.builder()
                .email("user" + n + "@example.com")
                .emailVerified(true)
                .phoneNumber("+1415555" + n)
                .phoneVerified(true)
                .passwordHash("$2a$04$placeholderplaceholderplaceholderplaceholderpla");
    }

    public static Account.AccountBuilder withSmsMfa() {
        return verified()
                .mfaEnabled(true)
                .mfaMethod(MfaMethod.SMS);
    }
}
