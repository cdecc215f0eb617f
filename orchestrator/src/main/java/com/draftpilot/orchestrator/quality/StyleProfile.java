package com.draftpilot.orchestrator.quality;

/**
 * What the article was asked to look like.
 *
 * @param targetLength target length in words
 */
public record StyleProfile(String style, String tone, int targetLength) {}
