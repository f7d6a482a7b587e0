package com.drautomation.api.config;

import com.drautomation.api.service.NextRunCalculator;
import com.drautomation.api.util.ReadOnlyQueries;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates critical configuration on application startup.
 * Fails fast if required configuration is missing or invalid.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupValidator {

    private final AutomationProperties properties;

    @PostConstruct
    public void validate() {
        log.info("Validating startup configuration...");

        validateSchedules();
        validateCrossRegion();
        validateRecoveryTesting();
        validateRestore();
        validateRecoverySteps();
        validateNotifications();

        log.info("Startup configuration validation complete");
    }

    private void validateSchedules() {
        AutomationProperties.Schedules schedules = properties.getBackup().getSchedules();
        try {
            ZoneId.of(schedules.getTimezone());
        } catch (DateTimeException e) {
            throw new IllegalStateException("automation.backup.schedules.timezone is not a valid zone: "
                    + schedules.getTimezone());
        }
        validateCron("daily", schedules.getDaily());
        validateCron("weekly", schedules.getWeekly());
        validateCron("monthly", schedules.getMonthly());
    }

    private void validateCron(String tier, String cron) {
        if (cron == null || cron.isBlank()) {
            log.info("Default {} backup schedule disabled", tier);
            return;
        }
        try {
            NextRunCalculator.toSpringCron(cron);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("automation.backup.schedules." + tier + " is invalid: " + e.getMessage());
        }
    }

    private void validateCrossRegion() {
        AutomationProperties.CrossRegion crossRegion = properties.getCrossRegion();
        if (!crossRegion.isEnabled()) {
            log.info("Cross-region replication disabled");
            return;
        }
        List<String> targets = crossRegion.getReplicationRegions().stream()
                .filter(r -> !r.equals(crossRegion.getPrimaryRegion()))
                .toList();
        if (targets.isEmpty()) {
            throw new IllegalStateException(
                    "Cross-region replication is enabled but no region other than the primary is configured");
        }
        log.info("Cross-region replication configured: {} -> {}", crossRegion.getPrimaryRegion(), targets);
    }

    private void validateRecoveryTesting() {
        int minIntegrity = properties.getRecoveryTesting().getThresholds().getMinDataIntegrity();
        if (minIntegrity < 0 || minIntegrity > 100) {
            throw new IllegalStateException(
                    "automation.recovery-testing.thresholds.min-data-integrity must be between 0 and 100");
        }
        String testDatabase = properties.getRecoveryTesting().getTestDatabase();
        if (testDatabase == null || !testDatabase.matches("^[A-Za-z_][A-Za-z0-9_]*$")) {
            throw new IllegalStateException(
                    "automation.recovery-testing.test-database has invalid format: " + testDatabase);
        }
        for (String query : properties.getRecoveryTesting().getValidationQueries()) {
            if (!ReadOnlyQueries.isReadOnlySelect(query)) {
                throw new IllegalStateException(
                        "automation.recovery-testing.validation-queries must be single SELECT statements: " + query);
            }
        }
    }

    private void validateRestore() {
        if (properties.getRestore().getBatchSize() <= 0) {
            throw new IllegalStateException("automation.restore.batch-size must be positive");
        }
    }

    private void validateRecoverySteps() {
        Map<String, Integer> orderById = new HashMap<>();
        for (AutomationProperties.RecoveryStep step : properties.getDisasterRecovery().getSteps()) {
            if (step.getId() == null || step.getType() == null) {
                throw new IllegalStateException("Every recovery step needs an id and a type");
            }
            if (orderById.put(step.getId(), step.getOrder()) != null) {
                throw new IllegalStateException("Duplicate recovery step id: " + step.getId());
            }
        }
        for (AutomationProperties.RecoveryStep step : properties.getDisasterRecovery().getSteps()) {
            for (String dependency : step.getDependencies()) {
                Integer dependencyOrder = orderById.get(dependency);
                if (dependencyOrder == null) {
                    throw new IllegalStateException(
                            "Recovery step " + step.getId() + " depends on unknown step " + dependency);
                }
                if (dependencyOrder >= step.getOrder()) {
                    throw new IllegalStateException(
                            "Recovery step " + step.getId() + " must run after its dependency " + dependency);
                }
            }
        }
    }

    private void validateNotifications() {
        AutomationProperties.Notifications notifications = properties.getNotifications();
        if (notifications.isEnabled() && (notifications.getWebhookUrl() == null || notifications.getWebhookUrl().isBlank())) {
            log.warn("Notification webhook URL not configured. Notifications will only be logged.");
        }
    }
}
