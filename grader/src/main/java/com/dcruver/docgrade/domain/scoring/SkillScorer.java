package com.dcruver.docgrade.domain.scoring;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores skill definitions.
 *
 * Thin-router skills are graded on how well they route to reference files; all other skills
 * are graded on inline methodology. Both rule sets spend the same 40 structural and
 * 40 practices points, so scores stay comparable across skill kinds.
 */
public class SkillScorer implements Scorer {

    static final String ANTI_PATTERNS_SECTION = "Anti-Patterns section";

    private static final ScorerComponent STANDARD = new StandardSkillRules();
    private static final ScorerComponent THIN_ROUTER = new ThinRouterSkillRules();

    @Override
    public QualityScore score(String content, Map<String, Object> frontmatter, String body) {
        String text = body != null ? body : "";
        boolean thinRouter = ThinRouterClassifier.isThinRouter(text, ScoringRules.countLines(content));
        return ScoreCombiner.computeCombinedScore(content, frontmatter, body, thinRouter ? THIN_ROUTER : STANDARD);
    }

    /**
     * Frontmatter, composition and documentation rules common to both skill kinds.
     */
    private abstract static class SkillRules implements ScorerComponent {

        private static final List<FieldSpec> REQUIRED_FIELDS = List.of(
            FieldSpec.of("name", 10),
            FieldSpec.of("description", 10)
        );

        // 500 line budget, OK band carries +10%
        private static final CompositionThresholds THRESHOLDS = CompositionThresholds.builder()
            .excellent(250).excellentNote("Excellent: ≤250 lines")
            .good(400).goodNote("Good: ≤400 lines")
            .ok(550).okNote("OK: ≤550 lines (500±10%)")
            .overLimit(660).overLimitNote("Over limit: >550 lines")
            .fatNote("Fat skill: >660 lines")
            .build();

        // Counts fence markers, so one closed block counts twice
        private static final GradedLadder CODE_EXAMPLES = GradedLadder.builder()
            .atLeast(6, 5, "Rich examples")
            .atLeast(3, 3, "Adequate examples")
            .atLeast(1, 1, "Few examples")
            .otherwise("No examples")
            .passAt(3)
            .build();

        abstract CategoryScore scoreSections(String body);

        @Override
        public CategoryScore scoreStructural(ScoringContext context) {
            return ScoringRules.scoreRequiredFields(context.getFrontmatter(), REQUIRED_FIELDS)
                .plus(scoreSections(context.getBody()));
        }

        @Override
        public CategoryScore scoreComposition(ScoringContext context) {
            return ScoringRules.scoreComposition(context.getLineCount(), THRESHOLDS);
        }

        @Override
        public CategoryScore scoreDocumentation(ScoringContext context) {
            int fences = ScoringRules.countOccurrences(context.getBody(), "```");
            return CategoryScore.of(List.of(
                DescriptionLadders.LONG_FORM.grade(MetricCategory.DOCUMENTATION,
                    DescriptionLadders.DESCRIPTION_QUALITY, context.description().length()),
                CODE_EXAMPLES.grade(MetricCategory.DOCUMENTATION, "Code examples", fences)
            ));
        }
    }

    /**
     * Methodology and pattern-library skills.
     */
    private static final class StandardSkillRules extends SkillRules {

        private static final String ANTI_PATTERNS_REGEX = "(## Anti-Patterns?|### Anti-Patterns?|\\| Anti-Pattern)";

        private static final List<SectionSpec> METHODOLOGY_SECTIONS = List.of(
            SectionSpec.of("## Quick Reference", "Quick Reference", 8),
            SectionSpec.of("## Workflow", "Workflow section", 6),
            SectionSpec.of(ANTI_PATTERNS_REGEX, ANTI_PATTERNS_SECTION, 4),
            SectionSpec.of("## Success Criteria", "Success Criteria", 2)
        );

        // Success Criteria carries no points for pattern libraries
        private static final List<SectionSpec> REFERENCE_SECTIONS = List.of(
            SectionSpec.of("## Quick Reference", "Quick Reference", 10),
            SectionSpec.of("(## Patterns?|## Templates?|## Examples?)", "Pattern/Template section", 6),
            SectionSpec.of(ANTI_PATTERNS_REGEX, ANTI_PATTERNS_SECTION, 4)
        );

        // "## Best Practices" with a "### Don't" subsection stands in for Anti-Patterns
        private static final SectionFallback BEST_PRACTICES_DONTS = (body, sectionName) ->
            ANTI_PATTERNS_SECTION.equals(sectionName)
                && body.contains("## Best Practices")
                && body.toLowerCase(Locale.ROOT).contains("### don't");

        private static final Pattern SEMANTIC_ROUTING = Pattern.compile("\\|.*User Question.*\\|.*Action.*\\|");
        private static final Pattern PHASES = Pattern.compile("### Phase \\d", Pattern.CASE_INSENSITIVE);
        private static final Pattern ANTI_PATTERN_TABLE = Pattern.compile("\\|.*Anti-Pattern.*\\|.*Problem.*\\|.*Fix.*\\|");
        private static final Pattern HARD_GATE = Pattern.compile("HARD GATE", Pattern.CASE_INSENSITIVE);
        private static final Pattern REFERENCE_FILES = Pattern.compile("references/\\w+\\.md");
        private static final Pattern SCORING_FORMULA = Pattern.compile("(score\\s*=|scoring formula)", Pattern.CASE_INSENSITIVE);

        @Override
        CategoryScore scoreSections(String body) {
            List<SectionSpec> sections = ThinRouterClassifier.isMethodology(body) ? METHODOLOGY_SECTIONS : REFERENCE_SECTIONS;
            return ScoringRules.scoreSectionsWithFallback(body, sections, BEST_PRACTICES_DONTS);
        }

        @Override
        public CategoryScore scorePractices(ScoringContext context) {
            String body = context.getBody();
            return CategoryScore.of(List.of(
                Metric.check(MetricCategory.PRACTICES, "Semantic routing table", SEMANTIC_ROUTING.matcher(body).find(), 10),
                Metric.check(MetricCategory.PRACTICES, "Phase-based workflow", PHASES.matcher(body).find(), 8),
                Metric.check(MetricCategory.PRACTICES, "Anti-patterns table format", ANTI_PATTERN_TABLE.matcher(body).find(), 6),
                Metric.check(MetricCategory.PRACTICES, "HARD GATE markers", HARD_GATE.matcher(body).find(), 4),
                Metric.check(MetricCategory.PRACTICES, "Success criteria checkboxes", body.contains("- [ ]"), 4),
                Metric.check(MetricCategory.PRACTICES, "References to references/", REFERENCE_FILES.matcher(body).find(), 4),
                Metric.check(MetricCategory.PRACTICES, "Scoring formula", SCORING_FORMULA.matcher(body).find(), 4)
            ));
        }
    }

    /**
     * Skills that dispatch to references/ files instead of carrying methodology inline.
     */
    private static final class ThinRouterSkillRules extends SkillRules {

        private static final List<SectionSpec> ROUTING_SECTIONS = List.of(
            SectionSpec.of("\\|.*Read\\(references/", "Routing table to references", 10),
            SectionSpec.of("references/[\\w.-]+\\.md", "Reference file mentions", 5),
            SectionSpec.of("\\|\\s*(User Question|Intent|When|If|Scenario|Situation|Need)\\s*\\|",
                "Decision/intent table", 5)
        );

        private static final Pattern REFERENCE_ROUTING = Pattern.compile("Read\\(references/");
        private static final Pattern RELATED_SKILLS =
            Pattern.compile("(## Related Skills|Related skills:|See also:)", Pattern.CASE_INSENSITIVE);
        private static final Pattern DEGENERALIZATION = Pattern.compile("degenerali[sz]", Pattern.CASE_INSENSITIVE);
        private static final Pattern ANTI_PATTERNS = Pattern.compile("anti-pattern", Pattern.CASE_INSENSITIVE);
        private static final Pattern SUCCESS_CRITERIA =
            Pattern.compile("(success criteria|- \\[ \\])", Pattern.CASE_INSENSITIVE);

        @Override
        CategoryScore scoreSections(String body) {
            return ScoringRules.scoreSections(body, ROUTING_SECTIONS);
        }

        @Override
        public CategoryScore scorePractices(ScoringContext context) {
            String body = context.getBody();
            return CategoryScore.of(List.of(
                Metric.check(MetricCategory.PRACTICES, "Reference routing pattern", REFERENCE_ROUTING.matcher(body).find(), 15),
                Metric.check(MetricCategory.PRACTICES, "Related skills / cross-links", RELATED_SKILLS.matcher(body).find(), 10),
                Metric.check(MetricCategory.PRACTICES, "Degeneralization notes", DEGENERALIZATION.matcher(body).find(), 5),
                Metric.check(MetricCategory.PRACTICES, ANTI_PATTERNS_SECTION, ANTI_PATTERNS.matcher(body).find(), 5),
                Metric.check(MetricCategory.PRACTICES, "Success criteria", SUCCESS_CRITERIA.matcher(body).find(), 5)
            ));
        }
    }
}
