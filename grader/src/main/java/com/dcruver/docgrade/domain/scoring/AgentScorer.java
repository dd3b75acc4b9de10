package com.dcruver.docgrade.domain.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores agent definitions.
 * Structural tops out at 35 and practices at 35, so a flawless agent lands at 90.
 */
public class AgentScorer implements Scorer, ScorerComponent {

    private static final List<FieldSpec> REQUIRED_FIELDS = List.of(
        FieldSpec.of("name", 5),
        FieldSpec.of("description", 5),
        FieldSpec.of("model", 5),
        FieldSpec.of("tools", 5)
    );

    private static final List<SectionSpec> REQUIRED_SECTIONS = List.of(
        SectionSpec.of("## Foundation", "Foundation section", 5),
        SectionSpec.of("### Phase", "Phase workflow", 4),
        SectionSpec.of("## Success Criteria", "Success Criteria", 3),
        SectionSpec.of("## Edge Cases", "Edge Cases", 3)
    );

    // Skill: foo, **Skill**: foo, Skill(foo) / Skill("foo"), or a "Skills:" list
    private static final List<Pattern> SKILL_REFERENCES = List.of(
        Pattern.compile("Skill:\\s*\\S+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\*\\*Skill\\*\\*:\\s*\\S+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("Skill\\(\\s*[\"']?[a-z0-9-]+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("Skills:\\s*\\n", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern ANTI_PATTERNS = Pattern.compile("## Anti-Patterns", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXPECTED_OUTPUT = Pattern.compile("## Expected Output", Pattern.CASE_INSENSITIVE);
    private static final Pattern HARD_GATE = Pattern.compile("HARD GATE", Pattern.CASE_INSENSITIVE);

    // 200 line budget, OK band carries +10%
    private static final CompositionThresholds THRESHOLDS = CompositionThresholds.builder()
        .excellent(120).excellentNote("Excellent: ≤120 lines")
        .good(180).goodNote("Good: ≤180 lines")
        .ok(220).okNote("OK: ≤220 lines (200±10%)")
        .overLimit(275).overLimitNote("Over limit: >220 lines")
        .fatNote("Fat agent: >275 lines")
        .build();

    private static final GradedLadder SECTION_STRUCTURE = GradedLadder.builder()
        .atLeast(6, 5, "Well-structured")
        .atLeast(4, 3, "Adequate structure")
        .atLeast(2, 1, "Minimal structure")
        .otherwise("Poor structure")
        .passAt(4)
        .build();

    @Override
    public QualityScore score(String content, Map<String, Object> frontmatter, String body) {
        return ScoreCombiner.computeCombinedScore(content, frontmatter, body, this);
    }

    @Override
    public CategoryScore scoreStructural(ScoringContext context) {
        return ScoringRules.scoreRequiredFields(context.getFrontmatter(), REQUIRED_FIELDS)
            .plus(ScoringRules.scoreSections(context.getBody(), REQUIRED_SECTIONS));
    }

    @Override
    public CategoryScore scorePractices(ScoringContext context) {
        String body = context.getBody();
        String desc = context.description();
        List<Metric> details = new ArrayList<>();

        boolean hasSkillRef = SKILL_REFERENCES.stream().anyMatch(p -> p.matcher(body).find());
        details.add(Metric.check(MetricCategory.PRACTICES, "Skill: reference", hasSkillRef, 10));

        details.add(Metric.check(MetricCategory.PRACTICES, "Anti-Patterns section",
            ANTI_PATTERNS.matcher(body).find(), 5));
        details.add(Metric.check(MetricCategory.PRACTICES, "Expected Output section",
            EXPECTED_OUTPUT.matcher(body).find(), 5));
        details.add(Metric.check(MetricCategory.PRACTICES, "HARD GATE markers",
            HARD_GATE.matcher(body).find(), 5));

        boolean thirdPerson = !desc.isEmpty() && !desc.strip().startsWith("I ");
        details.add(Metric.check(MetricCategory.PRACTICES, "Third-person description", thirdPerson, 5));

        details.add(Metric.check(MetricCategory.PRACTICES, "WHEN triggers in description",
            hasTriggerPhrase(desc), 5));

        return CategoryScore.of(details);
    }

    @Override
    public CategoryScore scoreComposition(ScoringContext context) {
        return ScoringRules.scoreComposition(context.getLineCount(), THRESHOLDS);
    }

    @Override
    public CategoryScore scoreDocumentation(ScoringContext context) {
        int headings = ScoringRules.countOccurrences(context.getBody(), "## ");
        return CategoryScore.of(List.of(
            DescriptionLadders.LONG_FORM.grade(MetricCategory.DOCUMENTATION,
                DescriptionLadders.DESCRIPTION_QUALITY, context.description().length()),
            SECTION_STRUCTURE.grade(MetricCategory.DOCUMENTATION, "Section structure", headings)
        ));
    }

    /**
     * PROACTIVELY, "use when" or "when user" anywhere in the description
     */
    static boolean hasTriggerPhrase(String description) {
        String lower = description.toLowerCase(Locale.ROOT);
        return description.toUpperCase(Locale.ROOT).contains("PROACTIVELY")
            || lower.contains("use when")
            || lower.contains("when user");
    }
}
