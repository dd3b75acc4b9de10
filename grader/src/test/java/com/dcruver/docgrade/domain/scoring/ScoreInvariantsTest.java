package com.dcruver.docgrade.domain.scoring;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties every scorer must hold regardless of input.
 */
class ScoreInvariantsTest {

    private static final List<Scorer> SCORERS = List.of(
        new AgentScorer(), new CommandScorer(), new SkillScorer(), new PluginScorer(), new OutputStyleScorer());

    private static final List<String> BODIES = List.of(
        "",
        "# Title\n",
        "## Workflow\n### Phase 1\n- [ ] done\nTask(x)\nHARD GATE\n```\ncode\n```\n",
        "| Intent | Action |\n| a | Read(references/a.md) |\nDegeneralization\n## Related Skills\n",
        "## Quick Reference\n| User Question | Action |\nScore = 1\nreferences/x.md\n--flag\n",
        "text\n".repeat(700)
    );

    private static final List<Map<String, Object>> FRONTMATTERS = List.of(
        Map.of(),
        Map.of("name", "x", "description", "I do things"),
        Map.of("name", 1, "description", List.of("a"), "tools", Map.of()),
        Map.ofEntries(
            Map.entry("name", "x"),
            Map.entry("description", "d".repeat(250)),
            Map.entry("model", "sonnet"),
            Map.entry("tools", "Read"),
            Map.entry("allowed-tools", "Read"),
            Map.entry("argument-hint", "<x>"),
            Map.entry("keep-coding-instructions", true),
            Map.entry("version", "1.0.0"),
            Map.entry("author", Map.of("name", "a")),
            Map.entry("keywords", List.of("k")),
            Map.entry("readme", "r"))
    );

    private List<QualityScore> allScores() {
        List<QualityScore> scores = new ArrayList<>();
        for (Scorer scorer : SCORERS) {
            for (String body : BODIES) {
                for (Map<String, Object> frontmatter : FRONTMATTERS) {
                    scores.add(scorer.score("---\nname: x\n---\n" + body, frontmatter, body));
                }
            }
        }
        return scores;
    }

    @Test
    void testOverallIsSumOfCategoriesAndDetails() {
        for (QualityScore score : allScores()) {
            int categories = score.getStructural() + score.getPractices()
                + score.getComposition() + score.getDocumentation();
            int details = score.getDetails().stream().mapToInt(Metric::getPoints).sum();

            assertEquals(categories, score.getOverall());
            assertEquals(details, score.getOverall());

            for (MetricCategory category : MetricCategory.values()) {
                int categoryDetails = score.getDetails().stream()
                    .filter(m -> m.getCategory() == category)
                    .mapToInt(Metric::getPoints)
                    .sum();
                assertEquals(score.getCategoryPoints(category), categoryDetails, category.getLabel());
            }
        }
    }

    @Test
    void testScoresStayWithinBounds() {
        for (QualityScore score : allScores()) {
            assertTrue(score.getOverall() >= 0 && score.getOverall() <= 100);
            assertTrue(score.getStructural() <= 40);
            assertTrue(score.getPractices() <= 40);
            assertTrue(score.getComposition() <= 10);
            assertTrue(score.getDocumentation() <= 10);
            assertEquals(Tier.fromScore(score.getOverall()), score.getTier());

            for (Metric metric : score.getDetails()) {
                assertTrue(metric.getPoints() >= 0, metric.getName());
                assertTrue(metric.getPoints() <= metric.getMaxPoints(), metric.getName());
            }
        }
    }

    @Test
    void testScoringIsDeterministic() {
        assertEquals(allScores(), allScores());
    }

    @Test
    void testMaximumCategoryWeightsAddUp() {
        int total = 0;
        for (MetricCategory category : MetricCategory.values()) {
            total += category.getMaxPoints();
        }
        assertEquals(100, total);
    }

    @Test
    void testNullInputsAreTolerated() {
        for (Scorer scorer : SCORERS) {
            QualityScore score = scorer.score(null, null, null);
            assertNotNull(score);
            assertEquals(score.getOverall(), score.getDetails().stream().mapToInt(Metric::getPoints).sum());
        }
    }

    @Test
    void testMoreLinesNeverRaiseComposition() {
        for (Scorer scorer : SCORERS) {
            int previous = Integer.MAX_VALUE;
            for (int lines = 1; lines <= 12000; lines += 37) {
                String content = "x\n".repeat(lines);
                int composition = scorer.score(content, Map.of(), "").getComposition();
                assertTrue(composition <= previous, scorer.getClass().getSimpleName() + " at " + lines);
                previous = composition;
            }
        }
    }
}
