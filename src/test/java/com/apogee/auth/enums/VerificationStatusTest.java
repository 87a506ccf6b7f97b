package com.apogee.auth.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationStatusTest {

    @Test
    void approvedAndExpiredAttemptsAreClosed() {
        assertThat(VerificationStatus.sourcesOf(VerificationStatus.APPROVED))
                .containsExactlyInAnyOrder(VerificationStatus.PENDING, VerificationStatus.FAILED);
        assertThat(VerificationStatus.sourcesOf(VerificationStatus.FAILED))
                .containsExactlyInAnyOrder(VerificationStatus.PENDING, VerificationStatus.FAILED);
        assertThat(VerificationStatus.APPROVED.canTransitionTo(VerificationStatus.FAILED)).isFalse();
        assertThat(VerificationStatus.EXPIRED.canTransitionTo(VerificationStatus.APPROVED)).isFalse();
    }
}
