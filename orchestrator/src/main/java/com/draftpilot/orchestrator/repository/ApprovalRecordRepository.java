package com.draftpilot.orchestrator.repository;

import com.draftpilot.orchestrator.model.ApprovalRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ApprovalRecordRepository extends JpaRepository<ApprovalRecord, UUID> {

    List<ApprovalRecord> findByJobIdOrderByApprovalRoundAsc(UUID jobId);
}
