package com.apogee.auth.repository;

import com.apogee.auth.entity.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    @Modifying
    @Query("DELETE FROM AuditLog a WHERE a.eventTime < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
