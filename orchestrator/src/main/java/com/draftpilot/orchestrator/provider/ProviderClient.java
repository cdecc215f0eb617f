package com.draftpilot.orchestrator.provider;

import java.time.Duration;

/**
 * Uniform contract over every LLM vendor API.
 *
 * Implementations translate vendor failures into {@link ProviderException}
 * with a {@link ProviderException.Kind}, and an interrupted call into
 * {@link com.draftpilot.orchestrator.resilience.OperationCancelledException}.
 * They do no retrying of their own.
 */
public interface ProviderClient {

    Vendor vendor();

    /** False when credentials or endpoint are missing; the router then skips this vendor. */
    boolean isConfigured();

    /**
     * @param model   vendor model name, see {@link Backend#model()}
     * @param timeout per-request deadline
     * @throws ProviderException on any vendor-side failure
     */
    Generation generate(String model, Prompt prompt, GenerationParams params, Duration timeout);
}
