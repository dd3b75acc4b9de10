package com.dcruver.docgrade.domain;

import com.dcruver.docgrade.domain.scoring.Tier;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of grading every component under a project directory.
 */
@Data
@Builder
public class ScanSummary {
    private final String root;
    private final Instant scannedAt;

    private final List<ScoredComponent> components;  // Ordered by path
    private final List<String> skipped;              // Files that could not be parsed

    // Aggregate statistics
    private final int totalComponents;
    private final double meanScore;
    private final Map<Tier, Integer> tierCounts;
    private final Map<ComponentType, Integer> typeCounts;
    private final List<ScoredComponent> lowestScoring;  // Ascending by overall, then path

    /**
     * Check if the mean score reaches the target
     */
    public boolean meetsTarget(int targetScore) {
        return totalComponents > 0 && meanScore >= targetScore;
    }

    /**
     * Number of components graded into the given tier
     */
    public int countFor(Tier tier) {
        return tierCounts != null ? tierCounts.getOrDefault(tier, 0) : 0;
    }

    /**
     * Number of components of the given type
     */
    public int countFor(ComponentType type) {
        return typeCounts != null ? typeCounts.getOrDefault(type, 0) : 0;
    }

    /**
     * The weakest components, at most limit of them
     */
    public List<ScoredComponent> lowestScoring(int limit) {
        if (lowestScoring == null) {
            return List.of();
        }
        return lowestScoring.subList(0, Math.min(limit, lowestScoring.size()));
    }
}
