package com.apogee.auth.entity;

import com.apogee.auth.enums.OtpPurpose;
import com.apogee.auth.enums.VerificationStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One dispatched code in the OTP ledger. Rows are appended on dispatch and only their status moves
 * afterwards.
 */
@Entity
@Table(name = "otp_verifications", indexes = {
        @Index(name = "idx_otp_destination_purpose", columnList = "destination, purpose"),
        @Index(name = "idx_otp_account", columnList = "account_id"),
        @Index(name = "idx_otp_created", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OtpVerification {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "account_id")
    private UUID accountId;

    @Column(name = "destination", nullable = false, length = 255)
    private String destination;

    @Column(name = "channel", nullable = false, length = 10)
    private String channel;

    @Enumerated(EnumType.STRING)
    @Column(name = "purpose", nullable = false, length = 20)
    private OtpPurpose purpose;

    @Column(name = "provider_reference", length = 100)
    private String providerReference;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private VerificationStatus status = VerificationStatus.PENDING;

    @Builder.Default
    @Column(name = "attempt_count", nullable = false)
    private int attemptCount = 0;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
