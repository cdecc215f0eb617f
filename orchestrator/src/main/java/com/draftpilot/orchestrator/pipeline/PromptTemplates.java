package com.draftpilot.orchestrator.pipeline;

import com.draftpilot.orchestrator.model.Job;
import com.draftpilot.orchestrator.provider.Prompt;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompts for the generating phases.
 */
final class PromptTemplates {

    private static final Pattern FIRST_HEADING = Pattern.compile("(?m)^#{1,6}\\s+(.+)$");

    private static final String WRITER_SYSTEM = """
            You are a professional content writer. You write clear, well-structured
            articles in markdown with section headings and short paragraphs.
            Never leave placeholders such as TODO or [insert ...] in the text.
            """;

    private PromptTemplates() {}

    static Prompt research(Job job) {
        return new Prompt("""
                You are a research assistant. Collect facts, angles and open questions
                a writer needs before drafting. Answer as a bulleted list.
                """, """
                Topic: %s
                Intended style: %s
                Intended tone: %s

                List the key facts, common misconceptions, useful examples and a
                suggested outline for an article of about %d words.
                """.formatted(job.getTopic(), orDefault(job.getStyle()), orDefault(job.getTone()),
                job.getTargetLength()));
    }

    static Prompt draft(Job job, String researchNotes) {
        return new Prompt(WRITER_SYSTEM, """
                Write an article on: %s

                Style: %s
                Tone: %s
                Length: about %d words

                Research notes:
                %s
                """.formatted(job.getTopic(), orDefault(job.getStyle()), orDefault(job.getTone()),
                job.getTargetLength(), orNone(researchNotes)));
    }

    static Prompt refine(Job job, String previousDraft, List<String> issues, String reviewerFeedback) {
        StringBuilder feedback = new StringBuilder();
        for (String issue : issues) {
            feedback.append("- ").append(issue).append('\n');
        }
        if (reviewerFeedback != null && !reviewerFeedback.isBlank()) {
            feedback.append("- Reviewer: ").append(reviewerFeedback).append('\n');
        }
        return new Prompt(WRITER_SYSTEM, """
                Revise the article below on "%s" (style: %s, tone: %s, about %d words).

                Fix these problems:
                %s
                Article:
                %s
                """.formatted(job.getTopic(), orDefault(job.getStyle()), orDefault(job.getTone()),
                job.getTargetLength(), feedback.length() == 0 ? "- Improve overall quality\n" : feedback,
                previousDraft));
    }

    static Prompt format(Job job, String draft) {
        return new Prompt("""
                You are a copy editor. Return only the final article in markdown:
                one H1 title, H2 section headings, no commentary before or after.
                """, """
                Polish the following article on "%s" for publication. Keep its content
                and length; fix formatting, headings, grammar and flow.

                %s
                """.formatted(job.getTopic(), draft));
    }

    /** First markdown heading of the article, else the topic. */
    static String titleOf(String article, String topic) {
        if (article != null) {
            Matcher m = FIRST_HEADING.matcher(article);
            if (m.find()) {
                return m.group(1).trim();
            }
        }
        return topic;
    }

    private static String orDefault(String value) {
        return value == null || value.isBlank() ? "not specified" : value;
    }

    private static String orNone(String value) {
        return value == null || value.isBlank() ? "(none)" : value;
    }
}
