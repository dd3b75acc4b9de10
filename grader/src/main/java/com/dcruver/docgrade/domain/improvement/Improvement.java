package com.dcruver.docgrade.domain.improvement;

import com.dcruver.docgrade.domain.scoring.MetricCategory;
import lombok.Builder;
import lombok.Data;

/**
 * A concrete change that would earn more points.
 */
@Data
@Builder
public class Improvement {
    private final MetricCategory category;
    private final String metricName;
    private final int pointsAvailable;
    private final Severity severity;
    private final String suggestion;
}
