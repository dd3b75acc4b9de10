package com.dcruver.docgrade.domain.scoring;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * A single scoring criterion and the points it earned.
 */
@Data
@Builder
public class Metric {
    private final MetricCategory category;
    private final String name;  // Human-readable check label
    private final int points;

    @JsonProperty("max_points")
    private final int maxPoints;

    private final boolean passed;
    private final String note;  // Optional graded label, e.g. "Comprehensive"; written as null when absent

    /**
     * Metric for an all-or-nothing check
     */
    public static Metric check(MetricCategory category, String name, boolean passed, int maxPoints) {
        return check(category, name, passed, maxPoints, null);
    }

    public static Metric check(MetricCategory category, String name, boolean passed, int maxPoints, String note) {
        return Metric.builder()
            .category(category)
            .name(name)
            .points(passed ? maxPoints : 0)
            .maxPoints(maxPoints)
            .passed(passed)
            .note(note)
            .build();
    }

    /**
     * Points this metric left on the table
     */
    @JsonIgnore
    public int getPointsMissing() {
        return maxPoints - points;
    }
}
