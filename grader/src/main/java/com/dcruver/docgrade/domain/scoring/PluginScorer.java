package com.dcruver.docgrade.domain.scoring;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Scores plugin manifests (plugin.json).
 * The frontmatter argument is the whole parsed manifest; the body is unused.
 * Every check here requires a non-empty value, not just a present key.
 */
public class PluginScorer implements Scorer, ScorerComponent {

    // Byte size rather than lines: manifests are often a single line
    private static final CompositionThresholds SIZE_THRESHOLDS = CompositionThresholds.builder()
        .excellent(1000).excellentNote("Excellent: ≤1KB")
        .good(2000).goodNote("Good: ≤2KB")
        .ok(5000).okNote("OK: ≤5KB")
        .overLimit(10000).overLimitNote("Large: ≤10KB")
        .fatNote("Too large: >10KB")
        .build();

    @Override
    public QualityScore score(String content, Map<String, Object> frontmatter, String body) {
        return ScoreCombiner.computeCombinedScore(content, frontmatter, body, this);
    }

    @Override
    public CategoryScore scoreStructural(ScoringContext context) {
        Map<String, Object> manifest = context.getFrontmatter();
        boolean hasAuthorName = !FrontmatterValues.nestedString(manifest, "author", "name").isEmpty();

        return CategoryScore.of(List.of(
            nonEmptyField(MetricCategory.STRUCTURAL, manifest, "name"),
            nonEmptyField(MetricCategory.STRUCTURAL, manifest, "description"),
            nonEmptyField(MetricCategory.STRUCTURAL, manifest, "version"),
            Metric.check(MetricCategory.STRUCTURAL, "Has author.name", hasAuthorName, 10)
        ));
    }

    @Override
    public CategoryScore scorePractices(ScoringContext context) {
        Map<String, Object> manifest = context.getFrontmatter();
        return CategoryScore.of(List.of(
            nonEmptyField(MetricCategory.PRACTICES, manifest, "homepage"),
            nonEmptyField(MetricCategory.PRACTICES, manifest, "repository"),
            nonEmptyField(MetricCategory.PRACTICES, manifest, "license"),
            Metric.check(MetricCategory.PRACTICES, "Has keywords",
                FrontmatterValues.hasNonEmptyList(manifest, "keywords"), 10)
        ));
    }

    @Override
    public CategoryScore scoreComposition(ScoringContext context) {
        int bytes = context.getContent().getBytes(StandardCharsets.UTF_8).length;
        return ScoringRules.scoreSize("File size", bytes, SIZE_THRESHOLDS);
    }

    @Override
    public CategoryScore scoreDocumentation(ScoringContext context) {
        boolean hasReadme = FrontmatterValues.hasNonEmptyString(context.getFrontmatter(), "readme");
        return CategoryScore.of(List.of(
            DescriptionLadders.PLUGIN.grade(MetricCategory.DOCUMENTATION,
                DescriptionLadders.DESCRIPTION_QUALITY, context.description().length()),
            Metric.check(MetricCategory.DOCUMENTATION, "Has readme", hasReadme, 5)
        ));
    }

    private static Metric nonEmptyField(MetricCategory category, Map<String, Object> manifest, String key) {
        return Metric.check(category, "Has " + key, FrontmatterValues.hasNonEmptyString(manifest, key), 10);
    }
}
