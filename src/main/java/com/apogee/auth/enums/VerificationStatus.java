package com.apogee.auth.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a verification attempt in the OTP ledger.
 */
public enum VerificationStatus {
    PENDING,
    APPROVED,
    FAILED,
    EXPIRED;

    public boolean canTransitionTo(VerificationStatus target) {
        switch (this) {
            case PENDING:
            case FAILED:
                return target == APPROVED || target == FAILED || target == EXPIRED;
            default:
                return false;
        }
    }

    /**
     * Statuses from which {@code target} may be entered; ledger updates are conditioned on them.
     */
    public static Set<VerificationStatus> sourcesOf(VerificationStatus target) {
        Set<VerificationStatus> sources = EnumSet.noneOf(VerificationStatus.class);
        for (VerificationStatus status : values()) {
            if (status.canTransitionTo(target)) {
                sources.add(status);
            }
        }
        return sources;
    }
}
