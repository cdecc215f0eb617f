package com.draftpilot.orchestrator.publishing;

/**
 * What the CMS returned for a published article.
 *
 * @param url public location, when the CMS reports one
 */
public record PublishReceipt(String externalId, String url) {}
