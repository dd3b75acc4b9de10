package com.dcruver.docgrade.domain.scoring;

import java.util.List;
import java.util.Map;

/**
 * Scores output-style definitions.
 */
public class OutputStyleScorer implements Scorer, ScorerComponent {

    private static final int SUBSTANTIAL_BODY_CHARS = 50;

    private static final CompositionThresholds THRESHOLDS = CompositionThresholds.builder()
        .excellent(50).excellentNote("Concise: ≤50 lines")
        .good(100).goodNote("Good: ≤100 lines")
        .ok(200).okNote("OK: ≤200 lines")
        .overLimit(500).overLimitNote("Large: ≤500 lines")
        .fatNote("Too large: >500 lines")
        .build();

    @Override
    public QualityScore score(String content, Map<String, Object> frontmatter, String body) {
        return ScoreCombiner.computeCombinedScore(content, frontmatter, body, this);
    }

    @Override
    public CategoryScore scoreStructural(ScoringContext context) {
        Map<String, Object> frontmatter = context.getFrontmatter();
        boolean hasFrontmatter = context.getContent().strip().startsWith("---");

        return CategoryScore.of(List.of(
            Metric.check(MetricCategory.STRUCTURAL, "Has frontmatter", hasFrontmatter, 10),
            Metric.check(MetricCategory.STRUCTURAL, "Has name",
                FrontmatterValues.hasNonEmptyString(frontmatter, "name"), 15),
            Metric.check(MetricCategory.STRUCTURAL, "Has description",
                FrontmatterValues.hasNonEmptyString(frontmatter, "description"), 15)
        ));
    }

    @Override
    public CategoryScore scorePractices(ScoringContext context) {
        int bodyLength = context.getBody().strip().length();
        boolean keepsCodingInstructions = context.getFrontmatter().containsKey("keep-coding-instructions");

        return CategoryScore.of(List.of(
            Metric.check(MetricCategory.PRACTICES, "Has body content", bodyLength > 0, 20),
            Metric.check(MetricCategory.PRACTICES, "Has keep-coding-instructions", keepsCodingInstructions, 10),
            Metric.check(MetricCategory.PRACTICES, "Substantial body content",
                bodyLength >= SUBSTANTIAL_BODY_CHARS, 10, bodyLengthNote(bodyLength))
        ));
    }

    @Override
    public CategoryScore scoreComposition(ScoringContext context) {
        return ScoringRules.scoreSize("File size", context.getLineCount(), THRESHOLDS);
    }

    @Override
    public CategoryScore scoreDocumentation(ScoringContext context) {
        String body = context.getBody();
        boolean hasFormatting = body.contains("#") || body.contains("- ") || body.contains("```");

        return CategoryScore.of(List.of(
            DescriptionLadders.OUTPUT_STYLE.grade(MetricCategory.DOCUMENTATION,
                DescriptionLadders.DESCRIPTION_QUALITY, context.description().length()),
            Metric.check(MetricCategory.DOCUMENTATION, "Uses markdown formatting", hasFormatting, 5)
        ));
    }

    private static String bodyLengthNote(int length) {
        if (length >= 200) {
            return "Rich content";
        } else if (length >= SUBSTANTIAL_BODY_CHARS) {
            return "Adequate content";
        } else if (length > 0) {
            return "Minimal content";
        }
        return "No content";
    }
}
