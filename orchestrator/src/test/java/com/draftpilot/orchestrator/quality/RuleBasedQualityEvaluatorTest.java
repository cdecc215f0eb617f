package com.draftpilot.orchestrator.quality;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RuleBasedQualityEvaluatorTest {

    private final RuleBasedQualityEvaluator evaluator = new RuleBasedQualityEvaluator(70);

    private static String words(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            sb.append("word");
            sb.append(i % 10 == 9 ? ". " : " ");
        }
        return sb.toString().trim();
    }

    /** Three paragraphs under a heading, {@code perParagraph} words each. */
    private static String article(int perParagraph) {
        return "# Title\n\n" + words(perParagraph) + "\n\n" + words(perParagraph) + "\n\n" + words(perParagraph);
    }

    @Test
    void wellFormedDraftOnTarget_scoresFull() {
        QualityVerdict verdict = evaluator.evaluate(article(100), new StyleProfile("technical", "neutral", 302));

        assertThat(verdict.score()).isEqualTo(100.0);
        assertThat(verdict.passing()).isTrue();
        assertThat(verdict.issues()).isEmpty();
    }

    @Test
    void emptyDraft_scoresZero() {
        QualityVerdict verdict = evaluator.evaluate("   ", new StyleProfile(null, null, 500));

        assertThat(verdict.score()).isZero();
        assertThat(verdict.passing()).isFalse();
        assertThat(verdict.issues()).containsExactly("Draft is empty");
    }

    @Test
    void missingStructure_deductsHeadingAndParagraphs() {
        QualityVerdict verdict = evaluator.evaluate(words(300), new StyleProfile(null, null, 300));

        assertThat(verdict.score()).isEqualTo(70.0);
        assertThat(verdict.passing()).isTrue();
        assertThat(verdict.issues()).contains("No section headings", "Only 1 paragraph(s)");
    }

    @Test
    void placeholderAndShortLength_failTheDraft() {
        String draft = "# Title\n\nTODO write intro.\n\nSecond part.\n\nThird part.";

        QualityVerdict verdict = evaluator.evaluate(draft, new StyleProfile(null, null, 1000));

        assertThat(verdict.passing()).isFalse();
        assertThat(verdict.issues()).contains("Contains placeholder text");
        assertThat(verdict.issues()).anyMatch(i -> i.startsWith("Length is"));
        assertThat(verdict.score()).isEqualTo(50.0);
    }

    @Test
    void longSentences_deducted() {
        String run = "word ".repeat(40).trim() + ".";
        String draft = "# Title\n\n" + run + "\n\n" + run + "\n\n" + run;

        QualityVerdict verdict = evaluator.evaluate(draft, new StyleProfile(null, null, 121));

        assertThat(verdict.issues()).containsExactly("Sentences average more than 30 words");
        assertThat(verdict.score()).isEqualTo(90.0);
    }

    @Test
    void countWords_splitsOnWhitespace() {
        assertThat(RuleBasedQualityEvaluator.countWords("  a b\n\nc\t d ")).isEqualTo(4);
        assertThat(RuleBasedQualityEvaluator.countWords("   ")).isZero();
    }

    @Test
    void verdict_rejectsOutOfRangeScore() {
        assertThatThrownBy(() -> new QualityVerdict(101, true, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
