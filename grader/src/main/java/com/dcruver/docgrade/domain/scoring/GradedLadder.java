package com.dcruver.docgrade.domain.scoring;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Step table mapping a measured quantity (description length, heading count, ...)
 * to points and a graded note. Steps are checked from the highest minimum down.
 */
public final class GradedLadder {

    private final List<Step> steps;
    private final String fallbackNote;
    private final int passAt;
    private final int maxPoints;

    private GradedLadder(List<Step> steps, String fallbackNote, int passAt) {
        this.steps = List.copyOf(steps);
        this.fallbackNote = fallbackNote;
        this.passAt = passAt;
        this.maxPoints = steps.isEmpty() ? 0 : steps.get(0).getPoints();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Metric grade(MetricCategory category, String name, int value) {
        int points = 0;
        String note = fallbackNote;
        for (Step step : steps) {
            if (value >= step.getMin()) {
                points = step.getPoints();
                note = step.getNote();
                break;
            }
        }
        return Metric.builder()
            .category(category)
            .name(name)
            .points(points)
            .maxPoints(maxPoints)
            .passed(value >= passAt)
            .note(note)
            .build();
    }

    @Value
    private static class Step {
        int min;
        int points;
        String note;
    }

    public static final class Builder {
        private final List<Step> steps = new ArrayList<>();
        private String fallbackNote;
        private int passAt;

        /**
         * Add a step; steps must be added from the highest minimum down
         */
        public Builder atLeast(int min, int points, String note) {
            steps.add(new Step(min, points, note));
            return this;
        }

        public Builder otherwise(String note) {
            this.fallbackNote = note;
            return this;
        }

        public Builder passAt(int passAt) {
            this.passAt = passAt;
            return this;
        }

        public GradedLadder build() {
            return new GradedLadder(steps, fallbackNote, passAt);
        }
    }
}
