package com.drautomation.api.model.enums;

/**
 * Component health, ordered from best to worst for aggregation.
 */
public enum HealthStatus {
    HEALTHY(0),
    OFFLINE(1),
    DEGRADED(2),
    CRITICAL(3);

    private final int rank;

    HealthStatus(int rank) {
        this.rank = rank;
    }

    public static HealthStatus worst(HealthStatus a, HealthStatus b) {
        return a.rank >= b.rank ? a : b;
    }

    public boolean isWorseThan(HealthStatus other) {
        return rank > other.rank;
    }
}
