package com.draftpilot.orchestrator.publishing;

/**
 * Destination for approved articles.
 */
public interface PublishingTarget {

    /**
     * @throws PublishingException when the target refuses or cannot be reached
     */
    PublishReceipt publish(PublishPayload payload);
}
