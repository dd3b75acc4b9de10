package com.dcruver.docgrade.domain.scoring;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores slash-command definitions.
 * Good commands are thin: they document flags and success criteria and delegate work through Task().
 */
public class CommandScorer implements Scorer, ScorerComponent {

    private static final List<FieldSpec> REQUIRED_FIELDS = List.of(
        FieldSpec.of("allowed-tools", 10),
        FieldSpec.of("description", 10),
        FieldSpec.of("argument-hint", 10)
    );

    private static final Pattern TASK_DELEGATION = Pattern.compile("Task\\([^)]+\\)");
    // A checklist only counts when the body opens with it
    private static final Pattern SUCCESS_CRITERIA =
        Pattern.compile("Success criteria|^\\s*- \\[ \\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern FLAGS = Pattern.compile("## Flags|--\\w+", Pattern.CASE_INSENSITIVE);

    // 50 line budget, OK band carries +10%
    private static final CompositionThresholds THRESHOLDS = CompositionThresholds.builder()
        .excellent(30).excellentNote("Excellent: ≤30 lines")
        .good(45).goodNote("Good: ≤45 lines")
        .ok(55).okNote("OK: ≤55 lines (50±10%)")
        .overLimit(65).overLimitNote("Over limit: >55 lines")
        .fatNote("Fat command: >65 lines")
        .build();

    @Override
    public QualityScore score(String content, Map<String, Object> frontmatter, String body) {
        return ScoreCombiner.computeCombinedScore(content, frontmatter, body, this);
    }

    @Override
    public CategoryScore scoreStructural(ScoringContext context) {
        boolean delegates = TASK_DELEGATION.matcher(context.getBody()).find();
        return ScoringRules.scoreRequiredFields(context.getFrontmatter(), REQUIRED_FIELDS)
            .plus(CategoryScore.of(Metric.check(MetricCategory.STRUCTURAL, "Task() delegation", delegates, 10)));
    }

    @Override
    public CategoryScore scorePractices(ScoringContext context) {
        String body = context.getBody();
        int taskCalls = ScoringRules.countOccurrences(body, "Task(");

        return CategoryScore.of(List.of(
            Metric.check(MetricCategory.PRACTICES, "Success criteria", SUCCESS_CRITERIA.matcher(body).find(), 15),
            Metric.check(MetricCategory.PRACTICES, "Task delegation", taskCalls >= 1, 15,
                pluralize(taskCalls, "Task() call")),
            Metric.check(MetricCategory.PRACTICES, "Flags documented", FLAGS.matcher(body).find(), 10)
        ));
    }

    @Override
    public CategoryScore scoreComposition(ScoringContext context) {
        return ScoringRules.scoreComposition(context.getLineCount(), THRESHOLDS);
    }

    @Override
    public CategoryScore scoreDocumentation(ScoringContext context) {
        boolean hasCodeExamples = context.getBody().contains("```");
        return CategoryScore.of(List.of(
            DescriptionLadders.COMMAND.grade(MetricCategory.DOCUMENTATION,
                DescriptionLadders.DESCRIPTION_QUALITY, context.description().length()),
            Metric.check(MetricCategory.DOCUMENTATION, "Code examples", hasCodeExamples, 5)
        ));
    }

    static String pluralize(int count, String singular) {
        return count == 1 ? "1 " + singular : count + " " + singular + "s";
    }
}
