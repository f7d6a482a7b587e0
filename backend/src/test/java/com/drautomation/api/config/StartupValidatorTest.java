package com.drautomation.api.config;

import com.drautomation.api.model.enums.RecoveryStepType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StartupValidator")
class StartupValidatorTest {

    private AutomationProperties properties;
    private StartupValidator validator;

    @BeforeEach
    void setUp() {
        properties = new AutomationProperties();
        validator = new StartupValidator(properties);
    }

    @Test
    @DisplayName("should accept the default configuration")
    void shouldAcceptDefaults() {
        assertThatNoException().isThrownBy(validator::validate);
    }

    @Nested
    @DisplayName("validateSchedules")
    class ValidateSchedules {

        @Test
        @DisplayName("should throw when the timezone is unknown")
        void shouldThrowOnBadTimezone() {
            properties.getBackup().getSchedules().setTimezone("Mars/Olympus");

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("timezone");
        }

        @Test
        @DisplayName("should throw when a cron expression is malformed")
        void shouldThrowOnBadCron() {
            properties.getBackup().getSchedules().setWeekly("0 0 3 * * SUN");

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("automation.backup.schedules.weekly");
        }

        @Test
        @DisplayName("should allow a blank cron to disable a tier")
        void shouldAllowBlankCron() {
            properties.getBackup().getSchedules().setMonthly("");

            assertThatNoException().isThrownBy(validator::validate);
        }
    }

    @Nested
    @DisplayName("validateCrossRegion")
    class ValidateCrossRegion {

        @Test
        @DisplayName("should throw when only the primary region is a target")
        void shouldThrowWithoutTargets() {
            properties.getCrossRegion().setEnabled(true);
            properties.getCrossRegion().setReplicationRegions(new ArrayList<>(List.of("us-east-1")));

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("no region other than the primary");
        }

        @Test
        @DisplayName("should accept a secondary region")
        void shouldAcceptSecondary() {
            properties.getCrossRegion().setEnabled(true);
            properties.getCrossRegion().setReplicationRegions(new ArrayList<>(List.of("us-east-1", "eu-west-1")));

            assertThatNoException().isThrownBy(validator::validate);
        }
    }

    @Nested
    @DisplayName("validateRecoveryTesting and restore")
    class ValidateRecoveryTesting {

        @Test
        @DisplayName("should throw when the integrity threshold is out of range")
        void shouldThrowOnThreshold() {
            properties.getRecoveryTesting().getThresholds().setMinDataIntegrity(120);

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("min-data-integrity");
        }

        @Test
        @DisplayName("should throw when a validation query writes")
        void shouldThrowOnWritingValidationQuery() {
            properties.getRecoveryTesting().setValidationQueries(
                    new ArrayList<>(List.of("SELECT COUNT(*) FROM users", "UPDATE users SET name = 'x'")));

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("automation.recovery-testing.validation-queries");
        }

        @Test
        @DisplayName("should throw when the test database name is not an identifier")
        void shouldThrowOnDatabaseName() {
            properties.getRecoveryTesting().setTestDatabase("test; DROP TABLE users");

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("test-database");
        }

        @Test
        @DisplayName("should throw when the restore batch size is not positive")
        void shouldThrowOnBatchSize() {
            properties.getRestore().setBatchSize(0);

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("batch-size");
        }
    }

    @Nested
    @DisplayName("validateRecoverySteps")
    class ValidateRecoverySteps {

        private AutomationProperties.RecoveryStep step(String id, int order, String... dependencies) {
            return AutomationProperties.RecoveryStep.builder()
                    .id(id)
                    .name(id)
                    .type(RecoveryStepType.VALIDATION)
                    .order(order)
                    .dependencies(new ArrayList<>(List.of(dependencies)))
                    .build();
        }

        @Test
        @DisplayName("should throw on duplicate step ids")
        void shouldThrowOnDuplicate() {
            properties.getDisasterRecovery().setSteps(new ArrayList<>(List.of(step("a", 1), step("a", 2))));

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Duplicate recovery step id: a");
        }

        @Test
        @DisplayName("should throw on a dependency to an unknown step")
        void shouldThrowOnUnknownDependency() {
            properties.getDisasterRecovery().setSteps(new ArrayList<>(List.of(step("a", 1, "missing"))));

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("unknown step missing");
        }

        @Test
        @DisplayName("should throw when a step is ordered before its dependency")
        void shouldThrowOnOrder() {
            properties.getDisasterRecovery().setSteps(new ArrayList<>(List.of(step("a", 2), step("b", 1, "a"))));

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("must run after its dependency a");
        }
    }
}
