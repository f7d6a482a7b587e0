package com.drautomation.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body posted to the notification webhook.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationMessage {

    public static final String TYPE_BACKUP_SUCCESS = "backup_success";
    public static final String TYPE_BACKUP_FAILURE = "backup_failure";
    public static final String TYPE_SCHEDULE_FAILURE = "schedule_failure";
    public static final String TYPE_RESTORE_SUCCESS = "restore_success";
    public static final String TYPE_RESTORE_FAILURE = "restore_failure";
    public static final String TYPE_REPLICATION_FAILURE = "replication_failure";
    public static final String TYPE_RECOVERY_TEST_SUCCESS = "recovery_test_success";
    public static final String TYPE_RECOVERY_TEST_FAILURE = "recovery_test_failure";
    public static final String TYPE_SYSTEM_ALERT = "system_alert";
    public static final String TYPE_DISASTER_RECOVERY = "disaster_recovery";

    private String type;
    private Instant timestamp;
    @Builder.Default
    private List<String> recipients = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
}
