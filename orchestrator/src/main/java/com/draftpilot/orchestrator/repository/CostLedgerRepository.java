package com.draftpilot.orchestrator.repository;

import com.draftpilot.orchestrator.model.CostLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Insert-only access to the cost ledger. Rows are kept for soft-deleted jobs.
 */
public interface CostLedgerRepository extends JpaRepository<CostLedgerEntry, UUID> {

    List<CostLedgerEntry> findByJobIdOrderByCreatedAtAsc(UUID jobId);
}
