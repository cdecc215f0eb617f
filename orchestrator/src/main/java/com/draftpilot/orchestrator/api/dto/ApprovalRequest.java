package com.draftpilot.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /jobs/{id}/approval.
 *
 * decision is "approved" or "rejected" (case-insensitive).
 */
public record ApprovalRequest(@NotBlank String decision,
                              @NotBlank String reviewer,
                              String           feedback) {}
