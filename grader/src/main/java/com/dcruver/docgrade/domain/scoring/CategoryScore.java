package com.dcruver.docgrade.domain.scoring;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Points and metrics produced by one category method.
 */
@Value
public class CategoryScore {
    int points;
    List<Metric> details;

    public static CategoryScore of(List<Metric> details) {
        int points = details.stream().mapToInt(Metric::getPoints).sum();
        return new CategoryScore(points, List.copyOf(details));
    }

    public static CategoryScore of(Metric metric) {
        return new CategoryScore(metric.getPoints(), List.of(metric));
    }

    /**
     * Concatenate this score with another, in order
     */
    public CategoryScore plus(CategoryScore other) {
        List<Metric> merged = new ArrayList<>(details);
        merged.addAll(other.details);
        return new CategoryScore(points + other.points, List.copyOf(merged));
    }
}
