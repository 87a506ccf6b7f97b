package com.apogee.auth.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * MFA challenge lifecycle for a single account.
 * <p>
 * NONE → CHALLENGE_ISSUED → CODE_SENT → VERIFIED | EXPIRED | INVALIDATED. A new challenge can be issued
 * from any state since only one live challenge exists per account.
 */
public enum MfaState {
    NONE,
    CHALLENGE_ISSUED,
    CODE_SENT,
    VERIFIED,
    EXPIRED,
    INVALIDATED;

    public Set<MfaState> allowedTransitions() {
        switch (this) {
            case CHALLENGE_ISSUED:
                return EnumSet.of(CHALLENGE_ISSUED, CODE_SENT, VERIFIED, EXPIRED, INVALIDATED);
            case CODE_SENT:
                return EnumSet.of(CHALLENGE_ISSUED, CODE_SENT, VERIFIED, EXPIRED, INVALIDATED);
            default:
                // NONE and the terminal states only accept a fresh challenge or a logout
                return EnumSet.of(CHALLENGE_ISSUED, INVALIDATED);
        }
    }

    public boolean canTransitionTo(MfaState target) {
        return allowedTransitions().contains(target);
    }

    /**
     * States from which {@code target} may be entered. Every conditional update of the MFA slot uses this as its
     * guard, so a write the table does not allow matches no row.
     */
    public static Set<MfaState> sourcesOf(MfaState target) {
        Set<MfaState> sources = EnumSet.noneOf(MfaState.class);
        for (MfaState state : values()) {
            if (state.canTransitionTo(target)) {
                sources.add(state);
            }
        }
        return sources;
    }

    /**
     * Whether a challenge in this state may still be consumed.
     */
    public boolean isLive() {
        return canTransitionTo(VERIFIED);
    }
}
