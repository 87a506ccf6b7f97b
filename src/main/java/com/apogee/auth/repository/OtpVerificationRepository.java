package com.apogee.auth.repository;

import com.apogee.auth.entity.OtpVerification;
import com.apogee.auth.enums.OtpPurpose;
import com.apogee.auth.enums.VerificationStatus;
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

@Repository
public interface OtpVerificationRepository extends JpaRepository<OtpVerification, UUID> {

    Optional<OtpVerification> findFirstByDestinationAndPurposeOrderByCreatedAtDesc(String destination,
                                                                                  OtpPurpose purpose);

    boolean existsByDestinationAndPurposeAndStatusAndVerifiedAtAfter(String destination,
                                                                    OtpPurpose purpose,
                                                                    VerificationStatus status,
                                                                    Instant since);

    boolean existsByAccountIdAndPurposeAndStatusAndVerifiedAtAfter(UUID accountId,
                                                                  OtpPurpose purpose,
                                                                  VerificationStatus status,
                                                                  Instant since);

    /**
     * Move an attempt to {@code status} only while it is still in one of {@code fromStatuses}.
     *
     * @return 0 when another request already closed the attempt
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OtpVerification o SET o.status = :status, o.attemptCount = o.attemptCount + :attempts " +
            "WHERE o.id = :id AND o.status IN :fromStatuses")
    int updateStatus(@Param("id") UUID id,
                     @Param("status") VerificationStatus status,
                     @Param("fromStatuses") Collection<VerificationStatus> fromStatuses,
                     @Param("attempts") int attempts);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OtpVerification o SET o.status = :status, o.verifiedAt = :verifiedAt, " +
            "o.attemptCount = o.attemptCount + 1 WHERE o.id = :id AND o.status IN :fromStatuses")
    int markApproved(@Param("id") UUID id,
                     @Param("status") VerificationStatus approvedStatus,
                     @Param("fromStatuses") Collection<VerificationStatus> fromStatuses,
                     @Param("verifiedAt") Instant verifiedAt);

    @Transactional
    @Modifying
    @Query("DELETE FROM OtpVerification o WHERE o.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}
