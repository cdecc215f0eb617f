package com.draftpilot.orchestrator.api.dto;

public record ErrorResponse(int status, String error, String message) {}
