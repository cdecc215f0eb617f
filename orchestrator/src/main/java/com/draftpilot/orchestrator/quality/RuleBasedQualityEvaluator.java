package com.draftpilot.orchestrator.quality;

import com.draftpilot.orchestrator.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Default evaluator: structural checks on markdown prose, no LLM call.
 *
 * Starts at 100 and deducts per finding:
 * <ul>
 *   <li>length outside 70%-130% of the target: up to 30</li>
 *   <li>no headings: 15</li>
 *   <li>fewer than three paragraphs: 15</li>
 *   <li>average sentence longer than 30 words: 10</li>
 *   <li>leftover placeholders (TODO, TBD, lorem ipsum, [insert ...]): 20</li>
 * </ul>
 */
@Component
public class RuleBasedQualityEvaluator implements QualityEvaluator {

    private static final Pattern HEADING      = Pattern.compile("(?m)^#{1,6}\\s+\\S");
    private static final Pattern PLACEHOLDER  = Pattern.compile("(?i)\\b(TODO|TBD|lorem ipsum)\\b|\\[insert[^\\]]*]");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(\\s|$)");
    private static final Pattern WHITESPACE   = Pattern.compile("\\s+");

    private final double threshold;

    @Autowired
    public RuleBasedQualityEvaluator(PipelineProperties properties) {
        this(properties.qualityThreshold());
    }

    public RuleBasedQualityEvaluator(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public QualityVerdict evaluate(String content, StyleProfile profile) {
        if (content == null || content.isBlank()) {
            return new QualityVerdict(0, false, List.of("Draft is empty"));
        }

        List<String> issues = new ArrayList<>();
        double score = 100;

        int words = countWords(content);
        int target = profile.targetLength();
        if (target > 0) {
            double ratio = (double) words / target;
            if (ratio < 0.7 || ratio > 1.3) {
                double off = Math.abs(1.0 - ratio);
                score -= Math.min(30, Math.round(off * 50));
                issues.add("Length is %d words, target is %d".formatted(words, target));
            }
        }

        if (!HEADING.matcher(content).find()) {
            score -= 15;
            issues.add("No section headings");
        }

        long paragraphs = Arrays.stream(content.split("\\n\\s*\\n"))
                .filter(p -> !p.isBlank())
                .count();
        if (paragraphs < 3) {
            score -= 15;
            issues.add("Only " + paragraphs + " paragraph(s)");
        }

        long sentences = SENTENCE_END.matcher(content).results().count();
        if (sentences > 0 && (double) words / sentences > 30) {
            score -= 10;
            issues.add("Sentences average more than 30 words");
        }

        if (PLACEHOLDER.matcher(content).find()) {
            score -= 20;
            issues.add("Contains placeholder text");
        }

        score = Math.max(0, score);
        return new QualityVerdict(score, score >= threshold, issues);
    }

    static int countWords(String content) {
        String trimmed = content.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}
