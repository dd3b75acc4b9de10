package com.dcruver.docgrade.reporting;

import com.dcruver.docgrade.domain.ComponentType;
import com.dcruver.docgrade.domain.ScanSummary;
import com.dcruver.docgrade.domain.ScoredComponent;
import com.dcruver.docgrade.domain.improvement.ImprovementAdvisor;
import com.dcruver.docgrade.domain.scoring.CommandScorer;
import com.dcruver.docgrade.domain.scoring.QualityScore;
import com.dcruver.docgrade.domain.scoring.Tier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoreReportFormatterTest {

    private ScoreReportFormatter formatter;
    private ScoredComponent command;

    @BeforeEach
    void setUp() {
        formatter = new ScoreReportFormatter(new ImprovementAdvisor());

        String body = "# Deploy\n\nTask(deployer)\n";
        QualityScore score = new CommandScorer().score(body, Map.of("allowed-tools", "Bash"), body);
        command = ScoredComponent.builder()
            .path("commands/deploy.md")
            .type(ComponentType.COMMAND)
            .score(score)
            .build();
    }

    private ScanSummary summary() {
        Map<Tier, Integer> tierCounts = new EnumMap<>(Tier.class);
        tierCounts.put(command.getScore().getTier(), 1);
        Map<ComponentType, Integer> typeCounts = new EnumMap<>(ComponentType.class);
        for (ComponentType type : ComponentType.values()) {
            typeCounts.put(type, 0);
        }
        typeCounts.put(ComponentType.COMMAND, 1);
        return ScanSummary.builder()
            .root("/work/project")
            .scannedAt(Instant.parse("2025-01-15T10:00:00Z"))
            .components(List.of(command))
            .skipped(List.of("agents/broken.md"))
            .totalComponents(1)
            .meanScore(command.getScore().getOverall())
            .tierCounts(tierCounts)
            .typeCounts(typeCounts)
            .lowestScoring(List.of(command))
            .build();
    }

    @Test
    void testConsoleHeadline() {
        QualityScore score = command.getScore();

        String output = formatter.format(command, OutputFormat.CONSOLE, false, false);

        assertEquals(String.format("commands/deploy.md [%s %d]%n", score.getTier(), score.getOverall()), output);
    }

    @Test
    void testConsoleVerboseBreakdown() {
        QualityScore score = command.getScore();

        String output = formatter.format(command, OutputFormat.CONSOLE, true, false);

        assertTrue(output.contains(String.format("Structural: %d/40  Practices: %d/40  Composition: %d/10  Documentation: %d/10",
            score.getStructural(), score.getPractices(), score.getComposition(), score.getDocumentation())));
        assertTrue(output.contains("✓ Has allowed-tools (10/10)"));
        assertTrue(output.contains("✗ Has description (0/10)"));
        assertTrue(output.contains("Task delegation (15/15) 1 Task() call"));
    }

    @Test
    void testConsoleImprovements() {
        String output = formatter.format(command, OutputFormat.CONSOLE, false, true);

        assertTrue(output.contains("Improvements:"));
        assertTrue(output.contains("+15 [medium] Add success criteria or open with a '- [ ]' checklist"));
        assertTrue(output.contains("+10 [high] Add the 'description' field"));
    }

    @Test
    void testJsonUsesWireNames() throws Exception {
        String output = formatter.format(command, OutputFormat.JSON, false, true);

        JsonNode json = new ObjectMapper().readTree(output);
        assertEquals("commands/deploy.md", json.get("file").asText());
        assertEquals("command", json.get("type").asText());
        assertEquals(command.getScore().getOverall(), json.get("quality").get("overall").asInt());
        assertEquals(command.getScore().getTier().name(), json.get("quality").get("tier").asText());

        JsonNode firstMetric = json.get("quality").get("details").get(0);
        assertEquals("structural", firstMetric.get("category").asText());
        assertEquals(10, firstMetric.get("max_points").asInt());
        assertTrue(firstMetric.has("note"));
        assertTrue(firstMetric.get("note").isNull());
        assertFalse(firstMetric.has("pointsMissing"));

        assertTrue(json.get("improvements").isArray());
        assertTrue(json.get("improvements").size() > 0);
        assertEquals("medium", json.get("improvements").get(0).get("severity").asText());
    }

    @Test
    void testJsonSummary() throws Exception {
        String output = formatter.format(summary(), OutputFormat.JSON, false, false);

        JsonNode json = new ObjectMapper().readTree(output);
        assertEquals(1, json.get("total_components").asInt());
        assertEquals("2025-01-15T10:00:00Z", json.get("scanned_at").asText());
        assertEquals("commands/deploy.md", json.get("results").get(0).get("file").asText());
        assertEquals("agents/broken.md", json.get("skipped").get(0).asText());
        assertFalse(json.get("results").get(0).has("improvements"));

        assertEquals(1, json.get("type_counts").get("command").asInt());
        assertEquals(0, json.get("type_counts").get("output-style").asInt());
        JsonNode weakest = json.get("lowest_scoring").get(0);
        assertEquals("commands/deploy.md", weakest.get("file").asText());
        assertEquals("command", weakest.get("type").asText());
        assertEquals(command.getScore().getOverall(), weakest.get("score").asInt());
    }

    @Test
    void testMarkdownSummary() {
        String output = formatter.format(summary(), OutputFormat.MARKDOWN, false, true);

        assertTrue(output.startsWith("# Component Quality Report"));
        assertTrue(output.contains("| File | Type | Tier | Score |"));
        assertTrue(output.contains(String.format("| commands/deploy.md | command | %s | %d |",
            command.getScore().getTier(), command.getScore().getOverall())));
        assertTrue(output.contains("## commands/deploy.md"));
        assertTrue(output.contains("| structural | Has allowed-tools | 10/10 |  |"));
        assertTrue(output.contains("### Improvements"));
        assertTrue(output.contains("## Skipped"));
        assertTrue(output.contains("- command: 1"));
        assertTrue(output.contains("- agent: 0"));
        assertTrue(output.contains("## Lowest Scoring"));
        assertTrue(output.contains(String.format("1. commands/deploy.md (%s %d)",
            command.getScore().getTier(), command.getScore().getOverall())));
        assertTrue(output.contains("- **+15** (medium) "));
    }

    @Test
    void testConsoleSummary() {
        String output = formatter.format(summary(), OutputFormat.CONSOLE, false, false);

        assertTrue(output.contains("Components: 1"));
        assertTrue(output.contains("Skipped (unparseable): 1"));
        assertTrue(output.contains("  - agents/broken.md"));
        assertTrue(output.contains("Types: agent=0 command=1 skill=0 plugin=0 output-style=0"));
        assertTrue(output.contains(String.format("Lowest scoring:%n  1. commands/deploy.md [%s %d]",
            command.getScore().getTier(), command.getScore().getOverall())));
    }

    @Test
    void testTierTable() {
        String output = formatter.formatTiers();

        assertTrue(output.contains("A   85-100"));
        assertTrue(output.contains("B   70-84"));
        assertTrue(output.contains("F    0-29"));
    }

    @Test
    void testOutputFormatNames() {
        assertEquals(OutputFormat.JSON, OutputFormat.fromName("json"));
        assertEquals(OutputFormat.CONSOLE, OutputFormat.fromName("text"));
        assertEquals(OutputFormat.MARKDOWN, OutputFormat.fromName(" Markdown "));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.fromName("xml"));
    }
}
