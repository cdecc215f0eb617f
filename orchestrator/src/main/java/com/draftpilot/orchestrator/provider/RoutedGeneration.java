package com.draftpilot.orchestrator.provider;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a routed provider call.
 *
 * @param generation text and reported usage
 * @param backend    backend that produced it
 * @param cost       cost from reported usage, or the phase estimate when none was reported
 * @param estimated  true when {@code cost} is the estimate
 * @param fallbacks  candidates given up on before {@code backend} succeeded
 */
public record RoutedGeneration(Generation generation,
                               Backend backend,
                               BigDecimal cost,
                               boolean estimated,
                               List<BackendFailure> fallbacks) {

    public String text() {
        return generation.text();
    }
}
