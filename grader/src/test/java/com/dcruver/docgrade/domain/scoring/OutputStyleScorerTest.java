package com.dcruver.docgrade.domain.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputStyleScorerTest {

    private static final String DESCRIPTION = "Explains every change as a short lesson, naming the concept "
        + "behind each edit so the reader learns as the code evolves.";

    private static final String BODY = """
        # Teaching Style

        - Name the concept behind each change.
        - Keep explanations under three sentences.
        """;

    private OutputStyleScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new OutputStyleScorer();
    }

    private static Metric metric(QualityScore score, String name) {
        return score.getDetails().stream()
            .filter(m -> m.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No metric named " + name));
    }

    @Test
    void testCompleteOutputStyle() {
        Map<String, Object> frontmatter = Map.of(
            "name", "Teaching",
            "description", DESCRIPTION,
            "keep-coding-instructions", true);
        String content = "---\nname: Teaching\n---\n" + BODY;

        QualityScore score = scorer.score(content, frontmatter, BODY);

        assertEquals(40, score.getStructural());
        assertEquals(40, score.getPractices());
        assertEquals(10, score.getComposition());
        assertEquals(10, score.getDocumentation());
        assertEquals("Adequate content", metric(score, "Substantial body content").getNote());
    }

    @Test
    void testKeepCodingInstructionsOnlyNeedsTheKey() {
        Map<String, Object> frontmatter = Map.of("name", "Terse", "keep-coding-instructions", false);

        QualityScore score = scorer.score("---\n---\n" + BODY, frontmatter, BODY);

        assertTrue(metric(score, "Has keep-coding-instructions").isPassed());
    }

    @Test
    void testPlainTextWithoutFrontmatter() {
        String content = "Be brief.";

        QualityScore score = scorer.score(content, Map.of(), content);

        assertFalse(metric(score, "Has frontmatter").isPassed());
        assertEquals(0, score.getStructural());
        assertTrue(metric(score, "Has body content").isPassed());
        assertFalse(metric(score, "Substantial body content").isPassed());
        assertEquals("Minimal content", metric(score, "Substantial body content").getNote());
        assertFalse(metric(score, "Uses markdown formatting").isPassed());
        assertEquals(20, score.getPractices());
    }

    @Test
    void testLeadingWhitespaceBeforeFrontmatter() {
        String content = "\n  ---\nname: x\n---\n";

        assertTrue(metric(scorer.score(content, Map.of(), ""), "Has frontmatter").isPassed());
    }

    @Test
    void testEmptyBody() {
        QualityScore score = scorer.score("---\nname: x\n---\n", Map.of("name", "x"), "   \n");

        assertFalse(metric(score, "Has body content").isPassed());
        assertEquals("No content", metric(score, "Substantial body content").getNote());
    }

    @Test
    void testSizeBands() {
        Metric size = metric(scorer.score("x\n".repeat(150), Map.of(), ""), "File size");

        assertEquals(6, size.getPoints());
        assertEquals("OK: ≤200 lines", size.getNote());
    }
}
