package com.draftpilot.orchestrator.model;

public enum ApprovalDecision {
    APPROVED,
    REJECTED
}
