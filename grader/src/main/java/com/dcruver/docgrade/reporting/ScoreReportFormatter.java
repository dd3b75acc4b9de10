package com.dcruver.docgrade.reporting;

import com.dcruver.docgrade.domain.ComponentType;
import com.dcruver.docgrade.domain.ScanSummary;
import com.dcruver.docgrade.domain.ScoredComponent;
import com.dcruver.docgrade.domain.improvement.Improvement;
import com.dcruver.docgrade.domain.improvement.ImprovementAdvisor;
import com.dcruver.docgrade.domain.scoring.Metric;
import com.dcruver.docgrade.domain.scoring.QualityScore;
import com.dcruver.docgrade.domain.scoring.Tier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders graded components as console text, JSON or a Markdown report.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScoreReportFormatter {

    // Entries in the lowest-scoring section of a scan report
    static final int LOWEST_SCORING_SHOWN = 5;

    private final ImprovementAdvisor improvementAdvisor;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Render a single graded component
     */
    public String format(ScoredComponent component, OutputFormat format, boolean verbose, boolean improvements) {
        return switch (format) {
            case CONSOLE -> {
                StringBuilder sb = new StringBuilder();
                appendConsole(sb, component, verbose, improvements);
                yield sb.toString();
            }
            case JSON -> toJson(componentView(component, improvements));
            case MARKDOWN -> {
                StringBuilder sb = new StringBuilder();
                appendMarkdownDetail(sb, component, improvements);
                yield sb.toString();
            }
        };
    }

    /**
     * Render a whole scan
     */
    public String format(ScanSummary summary, OutputFormat format, boolean verbose, boolean improvements) {
        return switch (format) {
            case CONSOLE -> formatConsoleSummary(summary, verbose, improvements);
            case JSON -> toJson(summaryView(summary, improvements));
            case MARKDOWN -> formatMarkdownSummary(summary, improvements);
        };
    }

    /**
     * Tier bands as a small table
     */
    public String formatTiers() {
        StringBuilder sb = new StringBuilder("Quality tiers:\n");
        int upper = 100;
        for (Tier tier : Tier.values()) {
            sb.append(String.format("  %s  %3d-%d%n", tier, tier.getMinScore(), upper));
            upper = tier.getMinScore() - 1;
        }
        sb.append("\nCategories: structural 40, practices 40, composition 10, documentation 10\n");
        return sb.toString();
    }

    // Console

    private void appendConsole(StringBuilder sb, ScoredComponent component, boolean verbose, boolean improvements) {
        QualityScore score = component.getScore();
        sb.append(String.format("%s [%s %d]%n", component.getPath(), score.getTier(), score.getOverall()));

        if (verbose) {
            sb.append(String.format("  Structural: %d/40  Practices: %d/40  Composition: %d/10  Documentation: %d/10%n",
                score.getStructural(), score.getPractices(), score.getComposition(), score.getDocumentation()));
            for (Metric metric : score.getDetails()) {
                sb.append(String.format("    %s %s (%d/%d)%s%n",
                    metric.isPassed() ? "✓" : "✗",
                    metric.getName(),
                    metric.getPoints(),
                    metric.getMaxPoints(),
                    metric.getNote() != null ? " " + metric.getNote() : ""));
            }
        }

        if (improvements) {
            List<Improvement> recommended = improvementAdvisor.recommend(score);
            if (!recommended.isEmpty()) {
                sb.append("  Improvements:\n");
                for (Improvement improvement : recommended) {
                    sb.append(String.format("    +%d [%s] %s%n",
                        improvement.getPointsAvailable(), improvement.getSeverity().getLabel(), improvement.getSuggestion()));
                }
            }
        }
    }

    private String formatConsoleSummary(ScanSummary summary, boolean verbose, boolean improvements) {
        StringBuilder sb = new StringBuilder();

        if (summary.getComponents().isEmpty()) {
            sb.append("No components found under ").append(summary.getRoot()).append("\n");
        }

        for (ScoredComponent component : summary.getComponents()) {
            appendConsole(sb, component, verbose, improvements);
        }

        sb.append("\n");
        sb.append(String.format("Components: %d  Mean score: %.1f%n", summary.getTotalComponents(), summary.getMeanScore()));

        StringBuilder tiers = new StringBuilder();
        for (Tier tier : Tier.values()) {
            tiers.append(String.format("%s=%d ", tier, summary.countFor(tier)));
        }
        sb.append("Tiers: ").append(tiers.toString().trim()).append("\n");

        StringBuilder types = new StringBuilder();
        for (ComponentType type : ComponentType.values()) {
            types.append(String.format("%s=%d ", type.getLabel(), summary.countFor(type)));
        }
        sb.append("Types: ").append(types.toString().trim()).append("\n");

        List<ScoredComponent> lowest = summary.lowestScoring(LOWEST_SCORING_SHOWN);
        if (!lowest.isEmpty()) {
            sb.append("Lowest scoring:\n");
            for (int i = 0; i < lowest.size(); i++) {
                QualityScore score = lowest.get(i).getScore();
                sb.append(String.format("  %d. %s [%s %d]%n", i + 1, lowest.get(i).getPath(), score.getTier(), score.getOverall()));
            }
        }

        if (!summary.getSkipped().isEmpty()) {
            sb.append(String.format("Skipped (unparseable): %d%n", summary.getSkipped().size()));
            for (String path : summary.getSkipped()) {
                sb.append("  - ").append(path).append("\n");
            }
        }

        return sb.toString();
    }

    // Markdown

    private String formatMarkdownSummary(ScanSummary summary, boolean improvements) {
        StringBuilder sb = new StringBuilder();

        sb.append("# Component Quality Report\n\n");
        sb.append(String.format("- Root: `%s`%n", summary.getRoot()));
        sb.append(String.format("- Components: %d%n", summary.getTotalComponents()));
        sb.append(String.format("- Mean score: %.1f / 100%n", summary.getMeanScore()));
        for (ComponentType type : ComponentType.values()) {
            sb.append(String.format("- %s: %d%n", type.getLabel(), summary.countFor(type)));
        }
        sb.append("\n");

        if (!summary.getComponents().isEmpty()) {
            sb.append("| File | Type | Tier | Score |\n");
            sb.append("|------|------|------|-------|\n");
            for (ScoredComponent component : summary.getComponents()) {
                sb.append(String.format("| %s | %s | %s | %d |%n",
                    escape(component.getPath()),
                    component.getType().getLabel(),
                    component.getScore().getTier(),
                    component.getScore().getOverall()));
            }
            sb.append("\n");
        }

        List<ScoredComponent> lowest = summary.lowestScoring(LOWEST_SCORING_SHOWN);
        if (!lowest.isEmpty()) {
            sb.append("## Lowest Scoring\n\n");
            for (ScoredComponent component : lowest) {
                sb.append(String.format("1. %s (%s %d)%n",
                    component.getPath(), component.getScore().getTier(), component.getScore().getOverall()));
            }
            sb.append("\n");
        }

        for (ScoredComponent component : summary.getComponents()) {
            appendMarkdownDetail(sb, component, improvements);
        }

        if (!summary.getSkipped().isEmpty()) {
            sb.append("## Skipped\n\n");
            for (String path : summary.getSkipped()) {
                sb.append("- ").append(path).append("\n");
            }
            sb.append("\n");
        }

        return sb.toString();
    }

    private void appendMarkdownDetail(StringBuilder sb, ScoredComponent component, boolean improvements) {
        QualityScore score = component.getScore();

        sb.append("## ").append(component.getPath()).append("\n\n");
        sb.append(String.format("**Tier %s** (%d/100): structural %d/40, practices %d/40, composition %d/10, documentation %d/10%n%n",
            score.getTier(), score.getOverall(),
            score.getStructural(), score.getPractices(), score.getComposition(), score.getDocumentation()));

        sb.append("| Category | Metric | Points | Note |\n");
        sb.append("|----------|--------|--------|------|\n");
        for (Metric metric : score.getDetails()) {
            sb.append(String.format("| %s | %s | %d/%d | %s |%n",
                metric.getCategory().getLabel(),
                escape(metric.getName()),
                metric.getPoints(),
                metric.getMaxPoints(),
                metric.getNote() != null ? escape(metric.getNote()) : ""));
        }
        sb.append("\n");

        if (improvements) {
            List<Improvement> recommended = improvementAdvisor.recommend(score);
            if (!recommended.isEmpty()) {
                sb.append("### Improvements\n\n");
                for (Improvement improvement : recommended) {
                    sb.append(String.format("- **+%d** (%s) %s%n",
                        improvement.getPointsAvailable(), improvement.getSeverity().getLabel(), escape(improvement.getSuggestion())));
                }
                sb.append("\n");
            }
        }
    }

    private String escape(String cell) {
        return cell.replace("|", "\\|");
    }

    // JSON

    private Map<String, Object> componentView(ScoredComponent component, boolean improvements) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("file", component.getPath());
        view.put("type", component.getType());
        view.put("quality", component.getScore());
        if (improvements) {
            view.put("improvements", improvementAdvisor.recommend(component.getScore()));
        }
        return view;
    }

    private Map<String, Object> summaryView(ScanSummary summary, boolean improvements) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("root", summary.getRoot());
        view.put("scanned_at", summary.getScannedAt());
        view.put("total_components", summary.getTotalComponents());
        view.put("mean_score", summary.getMeanScore());
        view.put("tier_counts", summary.getTierCounts());

        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        for (ComponentType type : ComponentType.values()) {
            typeCounts.put(type.getLabel(), summary.countFor(type));
        }
        view.put("type_counts", typeCounts);
        view.put("lowest_scoring", summary.lowestScoring(LOWEST_SCORING_SHOWN).stream()
            .map(this::rankView)
            .toList());

        view.put("results", summary.getComponents().stream()
            .map(component -> componentView(component, improvements))
            .toList());
        view.put("skipped", summary.getSkipped());
        return view;
    }

    private Map<String, Object> rankView(ScoredComponent component) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("file", component.getPath());
        view.put("type", component.getType());
        view.put("tier", component.getScore().getTier());
        view.put("score", component.getScore().getOverall());
        return view;
    }

    private String toJson(Object view) {
        try {
            return objectMapper.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            log.error("Failed to render JSON report", e);
            throw new IllegalStateException("Failed to render JSON report", e);
        }
    }
}
