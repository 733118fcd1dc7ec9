package com.abathur.core.priority;

import com.abathur.core.config.AbathurProperties;

/**
 * Weights applied to the five priority sub-scores. Non-negative and summing to 1.
 */
public record PriorityWeights(
    double base,
    double depth,
    double urgency,
    double blocking,
    double source
) {

    private static final double TOLERANCE = 1e-6;

    public static final PriorityWeights DEFAULTS = new PriorityWeights(0.30, 0.25, 0.25, 0.15, 0.05);

    public PriorityWeights {
        if (base < 0 || depth < 0 || urgency < 0 || blocking < 0 || source < 0) {
            throw new IllegalArgumentException("Priority weights must be non-negative");
        }
        double sum = base + depth + urgency + blocking + source;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Priority weights must sum to 1.0 but sum to " + sum);
        }
    }

    public static PriorityWeights from(AbathurProperties.Priority p) {
        return new PriorityWeights(p.getBaseWeight(), p.getDepthWeight(), p.getUrgencyWeight(),
                p.getBlockingWeight(), p.getSourceWeight());
    }
}
