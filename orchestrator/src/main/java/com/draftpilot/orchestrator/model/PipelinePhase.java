package com.draftpilot.orchestrator.model;

/**
 * One discrete step of the content pipeline.
 *
 * Refinement is not a phase of its own: a refinement round re-runs
 * {@link #DRAFT} with the previous draft and its issues as extra context.
 */
public enum PipelinePhase {
    RESEARCH,       // gathers background notes on the topic
    DRAFT,          // writes (or rewrites) the article body
    QUALITY_CHECK,  // scores the latest draft against the threshold
    FORMAT,         // final polish into publishable markdown
    PUBLISH         // hands the approved article to the CMS
}
