package com.draftpilot.orchestrator.publishing;

import java.util.UUID;

/**
 * Approved article handed to the CMS.
 *
 * @param content final markdown produced by the FORMAT phase
 */
public record PublishPayload(UUID jobId, String title, String content, String style, String tone, String approvedBy) {}
