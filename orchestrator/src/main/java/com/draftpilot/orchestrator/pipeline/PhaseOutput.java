package com.draftpilot.orchestrator.pipeline;

import com.draftpilot.orchestrator.provider.RoutedGeneration;
import com.draftpilot.orchestrator.publishing.PublishReceipt;
import com.draftpilot.orchestrator.quality.QualityVerdict;

import java.math.BigDecimal;

/**
 * What a phase handler produced. Exactly one of {@code generation},
 * {@code verdict} or {@code receipt} is set, depending on the phase.
 *
 * @param backend backend id, or the name of the local component that did the work
 * @param content text stored on the phase result
 */
public record PhaseOutput(String backend,
                          String content,
                          BigDecimal cost,
                          RoutedGeneration generation,
                          QualityVerdict verdict,
                          PublishReceipt receipt) {

    static PhaseOutput generated(RoutedGeneration generation) {
        return new PhaseOutput(generation.backend().id(), generation.text(), generation.cost(),
                generation, null, null);
    }

    static PhaseOutput evaluated(String evaluator, QualityVerdict verdict) {
        String summary = "score=%.1f passing=%s issues=%s".formatted(
                verdict.score(), verdict.passing(), verdict.issues());
        return new PhaseOutput(evaluator, summary, BigDecimal.ZERO, null, verdict, null);
    }

    static PhaseOutput published(String target, PublishReceipt receipt) {
        String summary = receipt.url() != null ? receipt.url() : "cms entry " + receipt.externalId();
        return new PhaseOutput(target, summary, BigDecimal.ZERO, null, null, receipt);
    }
}
