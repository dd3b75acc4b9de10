package com.dcruver.docgrade.domain.improvement;

import com.dcruver.docgrade.domain.scoring.Metric;
import com.dcruver.docgrade.domain.scoring.MetricCategory;
import com.dcruver.docgrade.domain.scoring.QualityScore;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns the unearned points of a score into improvement recommendations,
 * biggest gains first.
 */
@Component
public class ImprovementAdvisor {

    // Advice for checks whose name alone does not say what to write
    private static final Map<String, String> ADVICE = Map.ofEntries(
        Map.entry("Has model", "Add 'model: sonnet' to the frontmatter"),
        Map.entry("Foundation section", "Add a '## Foundation' section naming the skill it builds on"),
        Map.entry("Phase workflow", "Split the workflow into '### Phase N' steps"),
        Map.entry("Success Criteria", "Add a '## Success Criteria' section with a checklist"),
        Map.entry("Edge Cases", "Add an '## Edge Cases' section"),
        Map.entry("Skill: reference", "Move methodology into a skill and reference it with 'Skill: <name>'"),
        Map.entry("Anti-Patterns section", "Add an '## Anti-Patterns' section"),
        Map.entry("Expected Output section", "Add an '## Expected Output' section"),
        Map.entry("HARD GATE markers", "Mark blocking checks with HARD GATE"),
        Map.entry("Third-person description", "Write the description in the third person, not starting with \"I \""),
        Map.entry("WHEN triggers in description", "Say when to use it in the description, e.g. \"Use PROACTIVELY when ...\""),
        Map.entry("Task() delegation", "Delegate the work to an agent with Task(...)"),
        Map.entry("Task delegation", "Delegate the work to an agent with Task(...)"),
        Map.entry("Success criteria", "Add success criteria or open with a '- [ ]' checklist"),
        Map.entry("Flags documented", "Document the flags under '## Flags'"),
        Map.entry("Quick Reference", "Add a '## Quick Reference' section"),
        Map.entry("Workflow section", "Add a '## Workflow' section"),
        Map.entry("Pattern/Template section", "Add a '## Patterns' or '## Templates' section"),
        Map.entry("Semantic routing table", "Add a '| User Question | Action |' routing table"),
        Map.entry("Phase-based workflow", "Split the workflow into '### Phase N' steps"),
        Map.entry("Anti-patterns table format", "Present anti-patterns as an '| Anti-Pattern | Problem | Fix |' table"),
        Map.entry("Success criteria checkboxes", "Add a '- [ ]' success checklist"),
        Map.entry("References to references/", "Link detail files under references/"),
        Map.entry("Scoring formula", "State the scoring formula"),
        Map.entry("Routing table to references", "Add a table routing each case to Read(references/...)"),
        Map.entry("Reference file mentions", "Name the reference files (references/<topic>.md)"),
        Map.entry("Decision/intent table", "Add an '| Intent | ... |' decision table"),
        Map.entry("Reference routing pattern", "Route to reference files with Read(references/...)"),
        Map.entry("Related skills / cross-links", "Add a '## Related Skills' section"),
        Map.entry("Degeneralization notes", "Note what was degeneralized for this project"),
        Map.entry("Has keywords", "Add a non-empty 'keywords' list to the manifest"),
        Map.entry("Has author.name", "Add an 'author' object with a 'name'"),
        Map.entry("Has body content", "Write the style instructions in the body"),
        Map.entry("Substantial body content", "Expand the body to at least 50 characters of instructions"),
        Map.entry("Uses markdown formatting", "Structure the body with headings or lists"),
        Map.entry("Has readme", "Point 'readme' at the plugin's README"),
        Map.entry("Code examples", "Add fenced code examples"),
        Map.entry("Section structure", "Organise the body under more '## ' headings")
    );

    public List<Improvement> recommend(QualityScore score) {
        if (score == null || score.getDetails() == null) {
            return List.of();
        }

        // Stable sort keeps detail order among equal gains
        return score.getDetails().stream()
            .filter(metric -> metric.getPointsMissing() > 0)
            .map(this::toImprovement)
            .sorted(Comparator.comparingInt(Improvement::getPointsAvailable).reversed())
            .toList();
    }

    private Improvement toImprovement(Metric metric) {
        return Improvement.builder()
            .category(metric.getCategory())
            .metricName(metric.getName())
            .pointsAvailable(metric.getPointsMissing())
            .severity(severityOf(metric))
            .suggestion(suggest(metric))
            .build();
    }

    private Severity severityOf(Metric metric) {
        return switch (metric.getCategory()) {
            case STRUCTURAL -> metric.getName().startsWith("Has ") ? Severity.HIGH : Severity.MEDIUM;
            case PRACTICES -> Severity.MEDIUM;
            // Over the budget is urgent; a passing but not top band is not
            case COMPOSITION -> metric.isPassed() ? Severity.LOW : Severity.HIGH;
            case DOCUMENTATION -> Severity.LOW;
        };
    }

    private String suggest(Metric metric) {
        String name = metric.getName();
        String current = metric.getNote() != null ? " (currently " + metric.getNote() + ")" : "";

        if (metric.getCategory() == MetricCategory.COMPOSITION) {
            String unit = name.equals("Line count") ? "lines" : "size";
            return metric.isPassed()
                ? "Trim " + unit + " to reach the top size band" + current
                : "Cut " + unit + " back under the budget; extract detail into skills or references" + current;
        }
        if (name.equals("Description quality")) {
            return "Expand the description" + current;
        }

        String advice = ADVICE.get(name);
        if (advice != null) {
            return advice;
        }
        return name.startsWith("Has ")
            ? "Add the '" + name.substring(4) + "' field"
            : "Add: " + name;
    }
}
