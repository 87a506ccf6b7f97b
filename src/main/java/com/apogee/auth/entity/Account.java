package com.apogee.auth.entity;

import com.apogee.auth.enums.LoginMethod;
import com.apogee.auth.enums.MfaMethod;
import com.apogee.auth.enums.MfaState;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Account credential record. One row per user; holds the single valid refresh credential, the MFA
 * challenge slot, the password-reset slot and the logout watermark.
 * <p>
 * Refresh value, challenge token and reset token are only ever changed through the conditional
 * updates in {@link com.apogee.auth.repository.AccountRepository}.
 */
@Entity
@Table(name = "accounts", indexes = {
        @Index(name = "idx_account_email", columnList = "email", unique = true),
        @Index(name = "idx_account_phone", columnList = "phone_number", unique = true),
        @Index(name = "idx_account_mfa_session", columnList = "mfa_session_token")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account extends BaseEntity {

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Builder.Default
    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified = false;

    @Column(name = "phone_number", unique = true, length = 20)
    private String phoneNumber;

    @Builder.Default
    @Column(name = "phone_verified", nullable = false)
    private boolean phoneVerified = false;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "password_changed_at")
    private Instant passwordChangedAt;

    // Refresh credential and session tracking
    @Column(name = "refresh_token", length = 1024)
    private String refreshToken;

    @Column(name = "refresh_token_expires_at")
    private Instant refreshTokenExpiresAt;

    @Column(name = "session_started_at")
    private Instant sessionStartedAt;

    @Column(name = "token_invalidated_at")
    private Instant tokenInvalidatedAt;

    // MFA
    @Builder.Default
    @Column(name = "mfa_enabled", nullable = false)
    private boolean mfaEnabled = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "mfa_method", length = 10)
    private MfaMethod mfaMethod;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "mfa_state", nullable = false, length = 20)
    private MfaState mfaState = MfaState.NONE;

    @Column(name = "mfa_session_token", length = 128)
    private String mfaSessionToken;

    @Column(name = "mfa_session_expires_at")
    private Instant mfaSessionExpiresAt;

    @Column(name = "mfa_consumed_token", length = 128)
    private String mfaConsumedToken;

    // Password reset
    @Column(name = "password_reset_token", length = 128)
    private String passwordResetToken;

    @Column(name = "password_reset_expires_at")
    private Instant passwordResetExpiresAt;

    // Biometric
    @Builder.Default
    @Column(name = "biometric_enabled", nullable = false)
    private boolean biometricEnabled = false;

    @Column(name = "biometric_token_hash")
    private String biometricTokenHash;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "preferred_login_method", nullable = false, length = 20)
    private LoginMethod preferredLoginMethod = LoginMethod.EMAIL;

    @Column(name = "last_login_at")
    private Instant lastLoginAt;

    /**
     * Whether SMS can be offered as a second factor.
     */
    public boolean hasVerifiedPhone() {
        return phoneNumber != null && phoneVerified;
    }
}
