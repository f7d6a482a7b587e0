package com.drautomation.api.model.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HealthStatus")
class HealthStatusTest {

    @Test
    @DisplayName("should pick the worse of two statuses")
    void shouldPickWorse() {
        assertThat(HealthStatus.worst(HealthStatus.HEALTHY, HealthStatus.DEGRADED)).isEqualTo(HealthStatus.DEGRADED);
        assertThat(HealthStatus.worst(HealthStatus.CRITICAL, HealthStatus.OFFLINE)).isEqualTo(HealthStatus.CRITICAL);
        assertThat(HealthStatus.worst(HealthStatus.OFFLINE, HealthStatus.HEALTHY)).isEqualTo(HealthStatus.OFFLINE);
    }

    @Test
    @DisplayName("should rank offline between healthy and degraded")
    void shouldRankOffline() {
        assertThat(HealthStatus.OFFLINE.isWorseThan(HealthStatus.HEALTHY)).isTrue();
        assertThat(HealthStatus.OFFLINE.isWorseThan(HealthStatus.DEGRADED)).isFalse();
        assertThat(HealthStatus.DEGRADED.isWorseThan(HealthStatus.DEGRADED)).isFalse();
    }
}
