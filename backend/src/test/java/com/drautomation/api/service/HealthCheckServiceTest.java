package com.drautomation.api.service;

import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.model.dto.BackupStatistics;
import com.drautomation.api.model.dto.RecoveryTestStatistics;
import com.drautomation.api.model.dto.ReplicationStatistics;
import com.drautomation.api.model.dto.SystemStatus;
import com.drautomation.api.model.enums.AutomationComponent;
import com.drautomation.api.model.enums.HealthStatus;
import com.drautomation.api.repository.RecoveryExecutionRepository;
import com.drautomation.api.support.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@DisplayName("HealthCheckService")
@ExtendWith(MockitoExtension.class)
class HealthCheckServiceTest {

    @Mock private BackupService backupService;
    @Mock private ReplicationService replicationService;
    @Mock private RecoveryTestService recoveryTestService;
    @Mock private RecoveryExecutionRepository recoveryExecutionRepository;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
    private final CircuitBreakerRegistry circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();

    private AutomationProperties properties;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        properties = new AutomationProperties();

        lenient().when(backupService.getStatistics()).thenReturn(backupStats(100.0));
        lenient().when(replicationService.isEnabled()).thenReturn(true);
        lenient().when(replicationService.getStatistics()).thenReturn(ReplicationStatistics.builder()
                .successRate(100.0)
                .averageLatencyMs(1_500)
                .build());
        lenient().when(recoveryTestService.isEnabled()).thenReturn(true);
        lenient().when(recoveryTestService.getStatistics()).thenReturn(RecoveryTestStatistics.builder()
                .successRate(100.0)
                .averageIntegrityScore(98.0)
                .build());
        lenient().when(recoveryExecutionRepository.countByStatusIn(anyCollection())).thenReturn(0L);

        healthCheckService = new HealthCheckService(backupService, replicationService, recoveryTestService,
                recoveryExecutionRepository, circuitBreakerRegistry, properties, clock);
    }

    private static BackupStatistics backupStats(double successRate) {
        return BackupStatistics.builder()
                .successRate(successRate)
                .activeJobs(0)
                .totalBackups(12)
                .lastBackupTime(Instant.parse("2024-01-01T02:00:00Z"))
                .build();
    }

    private HealthStatus statusOf(SystemStatus status, AutomationComponent component) {
        return status.getComponents().get(component).getStatus();
    }

    @Test
    @DisplayName("should report every component healthy when all engines are fine")
    void shouldReportHealthy() {
        SystemStatus status = healthCheckService.check(true);

        assertThat(status.isRunning()).isTrue();
        assertThat(status.getOverall()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(status.getComponents()).hasSize(AutomationComponent.values().length);
        assertThat(status.getLastCheck()).isEqualTo(Instant.parse("2024-01-01T10:00:00Z"));
        assertThat(status.getMetrics().getBackupSuccessRate()).isEqualTo(100.0);
        assertThat(status.getMetrics().getReplicationLatencyMs()).isEqualTo(1_500);
    }

    @Nested
    @DisplayName("backup component")
    class Backup {

        @Test
        @DisplayName("should be critical below the degraded threshold")
        void shouldBeCritical() {
            when(backupService.getStatistics()).thenReturn(backupStats(70.0));

            SystemStatus status = healthCheckService.check(true);

            assertThat(statusOf(status, AutomationComponent.BACKUP)).isEqualTo(HealthStatus.CRITICAL);
            assertThat(status.getOverall()).isEqualTo(HealthStatus.CRITICAL);
            assertThat(status.getComponents().get(AutomationComponent.BACKUP).getMessage())
                    .contains("70.0%");
        }

        @Test
        @DisplayName("should be degraded between the thresholds")
        void shouldBeDegraded() {
            when(backupService.getStatistics()).thenReturn(backupStats(90.0));

            SystemStatus status = healthCheckService.check(true);

            assertThat(statusOf(status, AutomationComponent.BACKUP)).isEqualTo(HealthStatus.DEGRADED);
            assertThat(status.getOverall()).isEqualTo(HealthStatus.DEGRADED);
        }

        @Test
        @DisplayName("should be offline when the engine is disabled")
        void shouldBeOffline() {
            properties.getBackup().setEnabled(false);

            SystemStatus status = healthCheckService.check(true);

            assertThat(statusOf(status, AutomationComponent.BACKUP)).isEqualTo(HealthStatus.OFFLINE);
            assertThat(status.getOverall()).isEqualTo(HealthStatus.OFFLINE);
        }

        @Test
        @DisplayName("should be critical when statistics cannot be read")
        void shouldBeCriticalOnFailure() {
            when(backupService.getStatistics()).thenThrow(new IllegalStateException("database down"));

            SystemStatus status = healthCheckService.check(true);

            assertThat(statusOf(status, AutomationComponent.BACKUP)).isEqualTo(HealthStatus.CRITICAL);
            assertThat(status.getComponents().get(AutomationComponent.BACKUP).getMessage())
                    .isEqualTo("Statistics unavailable: database down");
            assertThat(statusOf(status, AutomationComponent.REPLICATION)).isEqualTo(HealthStatus.HEALTHY);
        }
    }

    @Nested
    @DisplayName("other components")
    class OtherComponents {

        @Test
        @DisplayName("should degrade replication when latency exceeds the threshold")
        void shouldDegradeOnLatency() {
            when(replicationService.getStatistics()).thenReturn(ReplicationStatistics.builder()
                    .successRate(100.0)
                    .averageLatencyMs(properties.getMonitoring().getReplicationLatencyThreshold().toMillis() + 1)
                    .build());

            SystemStatus status = healthCheckService.check(true);

            assertThat(statusOf(status, AutomationComponent.REPLICATION)).isEqualTo(HealthStatus.DEGRADED);
        }

        @Test
        @DisplayName("should report replication offline when disabled")
        void shouldReportReplicationOffline() {
            when(replicationService.isEnabled()).thenReturn(false);

            SystemStatus status = healthCheckService.check(true);

            assertThat(statusOf(status, AutomationComponent.REPLICATION)).isEqualTo(HealthStatus.OFFLINE);
        }

        @Test
        @DisplayName("should degrade disaster recovery while runs are active")
        void shouldDegradeOnActiveRecovery() {
            when(recoveryExecutionRepository.countByStatusIn(anyCollection())).thenReturn(1L);

            SystemStatus status = healthCheckService.check(true);

            assertThat(statusOf(status, AutomationComponent.DISASTER_RECOVERY)).isEqualTo(HealthStatus.DEGRADED);
            assertThat(status.getMetrics().getActiveRecoveries()).isEqualTo(1);
        }

        @Test
        @DisplayName("should degrade error handling when a circuit breaker is open")
        void shouldDegradeOnOpenBreaker() {
            circuitBreakerRegistry.circuitBreaker("storage").transitionToOpenState();

            SystemStatus status = healthCheckService.check(true);

            assertThat(statusOf(status, AutomationComponent.ERROR_HANDLING)).isEqualTo(HealthStatus.DEGRADED);
            assertThat(status.getMetrics().getOpenCircuitBreakers()).isEqualTo(1);
        }
    }
}
