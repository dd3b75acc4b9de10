package com.dcruver.docgrade.domain.scoring;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Overall quality score for one component.
 * Overall is always the sum of the four categories, which is also the sum of the detail points.
 */
@Data
@Builder
public class QualityScore {
    private final int overall;        // 0-100
    private final Tier tier;
    private final int structural;     // 0-40
    private final int practices;      // 0-40
    private final int composition;    // 0-10
    private final int documentation;  // 0-10
    private final List<Metric> details;

    /**
     * Build a score from category totals, deriving overall and tier
     */
    public static QualityScore of(int structural, int practices, int composition, int documentation,
                                  List<Metric> details) {
        int overall = structural + practices + composition + documentation;
        return QualityScore.builder()
            .overall(overall)
            .tier(Tier.fromScore(overall))
            .structural(structural)
            .practices(practices)
            .composition(composition)
            .documentation(documentation)
            .details(List.copyOf(details))
            .build();
    }

    /**
     * Points earned in one category
     */
    public int getCategoryPoints(MetricCategory category) {
        return switch (category) {
            case STRUCTURAL -> structural;
            case PRACTICES -> practices;
            case COMPOSITION -> composition;
            case DOCUMENTATION -> documentation;
        };
    }
}
