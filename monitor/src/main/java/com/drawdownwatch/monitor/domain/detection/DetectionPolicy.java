package com.drawdownwatch.monitor.domain.detection;

import java.util.List;

/**
 * Severity ladder in percent, ascending, and the rung from which an alert counts as critical.
 */
public record DetectionPolicy(List<Integer> rungs, int criticalThreshold) {

    public DetectionPolicy {
        if (rungs == null || rungs.isEmpty()) {
            throw new IllegalArgumentException("At least one detection rung is required");
        }
        rungs = rungs.stream().sorted().distinct().toList();
    }

    public static DetectionPolicy defaults() {
        return new DetectionPolicy(List.of(5, 10, 15, 20), 20);
    }

    public boolean isCritical(int threshold) {
        return threshold >= criticalThreshold;
    }
}
