package com.drautomation.api.config;

import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.RecoveryStepType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All settings under {@code automation.*}.
 */
@Data
@ConfigurationProperties(prefix = "automation")
public class AutomationProperties {

    /**
     * Start the scheduler and mark the system running once the application is ready.
     */
    private boolean autoStart = true;

    private Backup backup = new Backup();
    private CrossRegion crossRegion = new CrossRegion();
    private RecoveryTesting recoveryTesting = new RecoveryTesting();
    private Restore restore = new Restore();
    private DisasterRecovery disasterRecovery = new DisasterRecovery();
    private Monitoring monitoring = new Monitoring();
    private Notifications notifications = new Notifications();

    /**
     * Services the recovery pipeline can restart, keyed by name.
     */
    private Map<String, ServiceEndpoint> services = new LinkedHashMap<>();

    @Data
    public static class Backup {
        private boolean enabled = true;
        private Duration timeout = Duration.ofHours(2);
        private String sourceDatabase = "public";
        // Columns consulted for incremental/differential change capture and point-in-time cuts
        private List<String> timestampColumns = new ArrayList<>(List.of("updated_at", "created_at"));
        private Location location = new Location();
        private Encryption encryption = new Encryption();
        private Retention retention = new Retention();
        private Schedules schedules = new Schedules();
        private Files files = new Files();
        private Configuration configuration = new Configuration();
    }

    @Data
    public static class Location {
        private String region = "us-east-1";
        private String bucket = "dr-automation-backups";
        private String prefix = "backups/";
    }

    @Data
    public static class Encryption {
        private boolean enabled = true;
        // Base64-encoded 32-byte key
        private String key;
        private String keyId = "default";
    }

    @Data
    public static class Retention {
        private int keepDaily = 7;
        private int keepWeekly = 4;
        private int keepMonthly = 12;
        private int keepYearly = 3;
        private int maxAgeDays = 365;
        private long maxSizeBytes = 100L * 1024 * 1024 * 1024;
    }

    @Data
    public static class Schedules {
        private boolean seedDefaults = true;
        private BackupKind kind = BackupKind.FULL;
        private String timezone = "UTC";
        // Five-field cron expressions; blank disables the tier
        private String daily = "0 2 * * *";
        private String weekly = "0 3 * * 0";
        private String monthly = "0 4 1 * *";
    }

    @Data
    public static class Files {
        private List<String> roots = new ArrayList<>();
        private String restoreRoot = "./restore/files";
        private long maxFileSizeBytes = 50L * 1024 * 1024;
    }

    @Data
    public static class Configuration {
        private List<String> prefixes = new ArrayList<>(List.of("automation", "spring.application", "server"));
        private String restoreDirectory = "./restore/configuration";
    }

    @Data
    public static class CrossRegion {
        private boolean enabled = false;
        private String primaryRegion = "us-east-1";
        private List<String> replicationRegions = new ArrayList<>();
        private String bucket;
        private String kmsKeyId;
        private int replicaRetentionDays = 30;
        private Duration copyTimeout = Duration.ofMinutes(30);
    }

    @Data
    public static class RecoveryTesting {
        private boolean enabled = false;
        // Six-field Spring cron for the periodic test of the latest backup
        private String cron = "0 0 6 * * SUN";
        private String testDatabase = "recovery_test";
        private List<String> validationQueries = new ArrayList<>();
        private Thresholds thresholds = new Thresholds();
        private boolean notifyOnSuccess = false;
        private boolean notifyOnFailure = true;
        private boolean testAfterAutomatedBackup = true;
        private int historyLimit = 50;
    }

    @Data
    public static class Thresholds {
        private Duration maxRestoreTime = Duration.ofMinutes(30);
        private Duration maxValidationTime = Duration.ofMinutes(10);
        private int minDataIntegrity = 95;
    }

    @Data
    public static class Restore {
        private int batchSize = 1000;
        private String targetDatabase = "public";
        private Duration phaseTimeout = Duration.ofMinutes(30);
    }

    @Data
    public static class DisasterRecovery {
        private boolean enabled = true;
        private boolean autoFailover = false;
        private int rtoMinutes = 60;
        private int rpoMinutes = 15;
        private int failureThreshold = 3;
        private Duration retryBackoff = Duration.ofSeconds(2);
        /**
         * How long a timed-out step attempt may take to stop after being interrupted
         * before the step is failed without further retries.
         */
        private Duration stepCancelGrace = Duration.ofSeconds(30);
        private List<RecoveryStep> steps = defaultSteps();
    }

    @Data
    public static class Monitoring {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(1);
        private double healthyBackupRate = 95;
        private double degradedBackupRate = 80;
        private Duration replicationLatencyThreshold = Duration.ofMinutes(5);
        private Duration statisticsWindow = Duration.ofDays(7);
        private boolean alertNotifications = true;
    }

    @Data
    public static class Notifications {
        private boolean enabled = true;
        private String webhookUrl;
        private List<String> recipients = new ArrayList<>();
    }

    @Data
    public static class ServiceEndpoint {
        private String restartUrl;
        private String healthUrl;
    }

    /**
     * One step of the disaster-recovery plan.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecoveryStep {
        private String id;
        private String name;
        private RecoveryStepType type;
        private int order;
        private Duration timeout;
        private int retries;
        @Builder.Default
        private List<String> dependencies = new ArrayList<>();
        private boolean critical;
    }

    public static List<RecoveryStep> defaultSteps() {
        List<RecoveryStep> steps = new ArrayList<>();
        steps.add(RecoveryStep.builder()
                .id("validate_backup").name("Validate latest backup")
                .type(RecoveryStepType.VALIDATION).order(1)
                .timeout(Duration.ofMinutes(10)).retries(2)
                .critical(true).build());
        steps.add(RecoveryStep.builder()
                .id("restore_database").name("Restore database")
                .type(RecoveryStepType.DATABASE).order(2)
                .timeout(Duration.ofMinutes(30)).retries(1)
                .dependencies(new ArrayList<>(List.of("validate_backup")))
                .critical(true).build());
        steps.add(RecoveryStep.builder()
                .id("restore_files").name("Restore files")
                .type(RecoveryStepType.FILES).order(3)
                .timeout(Duration.ofMinutes(20)).retries(2)
                .dependencies(new ArrayList<>(List.of("validate_backup")))
                .critical(false).build());
        steps.add(RecoveryStep.builder()
                .id("restart_services").name("Restart services")
                .type(RecoveryStepType.SERVICE).order(4)
                .timeout(Duration.ofMinutes(5)).retries(3)
                .dependencies(new ArrayList<>(List.of("restore_database", "restore_files")))
                .critical(true).build());
        steps.add(RecoveryStep.builder()
                .id("validate_recovery").name("Validate recovery")
                .type(RecoveryStepType.VALIDATION).order(5)
                .timeout(Duration.ofMinutes(10)).retries(1)
                .dependencies(new ArrayList<>(List.of("restart_services")))
                .critical(true).build());
        return steps;
    }
}
