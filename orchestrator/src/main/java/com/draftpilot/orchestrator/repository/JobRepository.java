package com.draftpilot.orchestrator.repository;

import com.draftpilot.orchestrator.model.Job;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + executor queries for the jobs table.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Lock up to {@code limit} unclaimed, dispatchable jobs, oldest first.
     *
     * SELECT ... FOR UPDATE SKIP LOCKED:
     *   - FOR UPDATE  : other transactions cannot claim the same rows
     *   - SKIP LOCKED : rows locked by an overlapping poll cycle are skipped, not waited on
     *
     * Must run inside a transaction that stamps claimed_by before it commits.
     */
    @Query(value = """
            SELECT * FROM jobs
            WHERE status IN (:statuses)
              AND claimed_by IS NULL
              AND deleted_at IS NULL
            ORDER BY created_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<Job> lockClaimable(@Param("statuses") Collection<String> statuses, @Param("limit") int limit);

    /** Row-lock one job for a guarded status write. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    /** Jobs still claimed after {@code cutoff}: their run died without releasing them. */
    List<Job> findByClaimedByIsNotNullAndClaimedAtBefore(Instant cutoff);

    Optional<Job> findByIdAndDeletedAtIsNull(UUID id);
}
