package com.dcruver.docgrade.domain.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reusable rule evaluators shared by every scorer.
 * New fields, sections or size policies are added through the rule tables.
 */
public final class ScoringRules {

    private ScoringRules() {
    }

    /**
     * Award each field's points when its key is present in the frontmatter.
     * Presence only: the value's type and content are not inspected.
     */
    public static CategoryScore scoreRequiredFields(Map<String, Object> frontmatter, List<FieldSpec> specs) {
        List<Metric> details = new ArrayList<>();
        for (FieldSpec field : specs) {
            boolean exists = frontmatter != null && frontmatter.containsKey(field.getName());
            details.add(Metric.check(MetricCategory.STRUCTURAL, "Has " + field.getName(), exists, field.getPoints()));
        }
        return CategoryScore.of(details);
    }

    /**
     * Award each section's points when its pattern matches the body at least once.
     */
    public static CategoryScore scoreSections(String body, List<SectionSpec> specs) {
        return scoreSectionsWithFallback(body, specs, null);
    }

    /**
     * Like {@link #scoreSections}, but a section whose pattern misses may still pass
     * when the fallback accepts it.
     */
    public static CategoryScore scoreSectionsWithFallback(String body, List<SectionSpec> specs, SectionFallback fallback) {
        String text = body != null ? body : "";
        List<Metric> details = new ArrayList<>();
        for (SectionSpec section : specs) {
            boolean matched = section.matches(text);
            if (!matched && fallback != null) {
                matched = fallback.matches(text, section.getName());
            }
            details.add(Metric.check(MetricCategory.STRUCTURAL, section.getName(), matched, section.getPoints()));
        }
        return CategoryScore.of(details);
    }

    /**
     * Grade a line count against the thresholds: 10, 8 and 6 points pass; 3 and 0 do not.
     */
    public static CategoryScore scoreComposition(int lines, CompositionThresholds thresholds) {
        return scoreSize("Line count", lines, thresholds);
    }

    /**
     * Size ladder for any unit (lines or bytes)
     */
    static CategoryScore scoreSize(String metricName, int size, CompositionThresholds thresholds) {
        int points;
        String note;
        boolean passed;

        if (size <= thresholds.getExcellent()) {
            points = 10;
            note = thresholds.getExcellentNote();
            passed = true;
        } else if (size <= thresholds.getGood()) {
            points = 8;
            note = thresholds.getGoodNote();
            passed = true;
        } else if (size <= thresholds.getOk()) {
            points = 6;
            note = thresholds.getOkNote();
            passed = true;
        } else if (size <= thresholds.getOverLimit()) {
            points = 3;
            note = thresholds.getOverLimitNote();
            passed = false;
        } else {
            points = 0;
            note = thresholds.getFatNote();
            passed = false;
        }

        return CategoryScore.of(Metric.builder()
            .category(MetricCategory.COMPOSITION)
            .name(metricName)
            .points(points)
            .maxPoints(10)
            .passed(passed)
            .note(note)
            .build());
    }

    /**
     * Lines in a document: newline count plus one
     */
    public static int countLines(String content) {
        if (content == null) {
            return 1;
        }
        return countOccurrences(content, "\n") + 1;
    }

    /**
     * Non-overlapping occurrences of a literal substring
     */
    public static int countOccurrences(String text, String literal) {
        if (text == null || text.isEmpty() || literal.isEmpty()) {
            return 0;
        }
        int count = 0;
        int index = text.indexOf(literal);
        while (index >= 0) {
            count++;
            index = text.indexOf(literal, index + literal.length());
        }
        return count;
    }
}
