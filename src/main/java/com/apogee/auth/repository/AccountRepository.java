package com.apogee.auth.repository;

import com.apogee.auth.entity.Account;
import com.apogee.auth.enums.MfaState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Account credential records.
 * <p>
 * Every mutation of the refresh value, the MFA challenge slot and the reset slot is a conditional
 * update; callers must treat a zero row count as a conflict.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByEmail(String email);

    Optional<Account> findByPhoneNumber(String phoneNumber);

    boolean existsByEmail(String email);

    boolean existsByPhoneNumber(String phoneNumber);

    @Query("SELECT a.tokenInvalidatedAt FROM Account a WHERE a.id = :id")
    Instant findTokenInvalidatedAt(@Param("id") UUID id);

    // Refresh credential

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.refreshToken = :token, a.refreshTokenExpiresAt = :expiresAt, " +
            "a.sessionStartedAt = :sessionStartedAt, a.lastLoginAt = :now, a.updatedAt = :now, " +
            "a.version = a.version + 1 WHERE a.id = :id")
    int storeRefreshToken(@Param("id") UUID id,
                          @Param("token") String token,
                          @Param("expiresAt") Instant expiresAt,
                          @Param("sessionStartedAt") Instant sessionStartedAt,
                          @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.refreshToken = :newToken, a.refreshTokenExpiresAt = :expiresAt, " +
            "a.tokenInvalidatedAt = null, a.updatedAt = :now, a.version = a.version + 1 " +
            "WHERE a.id = :id AND a.refreshToken = :expected AND a.refreshTokenExpiresAt > :now")
    int rotateRefreshToken(@Param("id") UUID id,
                           @Param("expected") String expected,
                           @Param("newToken") String newToken,
                           @Param("expiresAt") Instant expiresAt,
                           @Param("now") Instant now);

    /**
     * Ends every session. The refresh slot is always cleared; the MFA slot only moves when its current state
     * allows the transition.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.refreshToken = null, a.refreshTokenExpiresAt = null, a.tokenInvalidatedAt = :now, " +
            "a.mfaSessionToken = null, a.mfaSessionExpiresAt = null, " +
            "a.mfaState = CASE WHEN a.mfaState IN :fromStates THEN :state ELSE a.mfaState END, " +
            "a.updatedAt = :now, a.version = a.version + 1 WHERE a.id = :id")
    int logout(@Param("id") UUID id,
               @Param("state") MfaState invalidatedState,
               @Param("fromStates") Collection<MfaState> fromStates,
               @Param("now") Instant now);

    // MFA challenge slot

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.mfaSessionToken = :token, a.mfaSessionExpiresAt = :expiresAt, " +
            "a.mfaState = :state, a.updatedAt = :now, a.version = a.version + 1 " +
            "WHERE a.id = :id AND a.mfaState IN :fromStates")
    int issueMfaChallenge(@Param("id") UUID id,
                          @Param("token") String token,
                          @Param("expiresAt") Instant expiresAt,
                          @Param("state") MfaState issuedState,
                          @Param("fromStates") Collection<MfaState> fromStates,
                          @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.mfaState = :state, a.updatedAt = :now, a.version = a.version + 1 " +
            "WHERE a.id = :id AND a.mfaSessionToken = :token AND a.mfaSessionExpiresAt > :now " +
            "AND a.mfaState IN :fromStates")
    int markMfaCodeSent(@Param("id") UUID id,
                        @Param("token") String token,
                        @Param("state") MfaState codeSentState,
                        @Param("fromStates") Collection<MfaState> fromStates,
                        @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.mfaSessionToken = null, a.mfaSessionExpiresAt = null, " +
            "a.mfaConsumedToken = :token, a.mfaState = :state, a.updatedAt = :now, a.version = a.version + 1 " +
            "WHERE a.id = :id AND a.mfaSessionToken = :token AND a.mfaSessionExpiresAt > :now " +
            "AND a.mfaState IN :fromStates")
    int consumeMfaChallenge(@Param("id") UUID id,
                            @Param("token") String token,
                            @Param("state") MfaState verifiedState,
                            @Param("fromStates") Collection<MfaState> fromStates,
                            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.mfaSessionToken = null, a.mfaSessionExpiresAt = null, " +
            "a.mfaState = :state, a.version = a.version + 1 " +
            "WHERE a.id = :id AND a.mfaSessionToken = :token AND a.mfaState IN :fromStates")
    int expireMfaChallenge(@Param("id") UUID id,
                           @Param("token") String token,
                           @Param("state") MfaState expiredState,
                           @Param("fromStates") Collection<MfaState> fromStates);

    // Password reset slot

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.passwordResetToken = :token, a.passwordResetExpiresAt = :expiresAt, " +
            "a.updatedAt = :now, a.version = a.version + 1 WHERE a.id = :id")
    int issueResetToken(@Param("id") UUID id,
                        @Param("token") String token,
                        @Param("expiresAt") Instant expiresAt,
                        @Param("now") Instant now);

    /**
     * Sets the new password hash and ends every session, only while the reset token is unused and unexpired.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.passwordHash = :passwordHash, a.passwordChangedAt = :now, " +
            "a.passwordResetToken = null, a.passwordResetExpiresAt = null, " +
            "a.refreshToken = null, a.refreshTokenExpiresAt = null, a.tokenInvalidatedAt = :now, " +
            "a.updatedAt = :now, a.version = a.version + 1 " +
            "WHERE a.id = :id AND a.passwordResetToken = :token AND a.passwordResetExpiresAt > :now")
    int consumeResetToken(@Param("id") UUID id,
                          @Param("token") String token,
                          @Param("passwordHash") String passwordHash,
                          @Param("now") Instant now);
}
