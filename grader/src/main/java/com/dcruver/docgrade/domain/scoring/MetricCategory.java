package com.dcruver.docgrade.domain.scoring;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four weighted categories of a quality score.
 */
public enum MetricCategory {
    /**
     * Required fields and sections (0-40)
     */
    STRUCTURAL("structural", 40),

    /**
     * Best-practice patterns (0-40)
     */
    PRACTICES("practices", 40),

    /**
     * Size relative to the per-type budget (0-10)
     */
    COMPOSITION("composition", 10),

    /**
     * Description and example quality (0-10)
     */
    DOCUMENTATION("documentation", 10);

    private final String label;
    private final int maxPoints;

    MetricCategory(String label, int maxPoints) {
        this.label = label;
        this.maxPoints = maxPoints;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getMaxPoints() {
        return maxPoints;
    }
}
