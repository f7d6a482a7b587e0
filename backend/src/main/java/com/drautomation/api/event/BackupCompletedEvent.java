package com.drautomation.api.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a backup job reaches a terminal status.
 * {@code backupId} is null unless the job completed.
 */
@Getter
public class BackupCompletedEvent extends ApplicationEvent {

    private final String jobId;
    private final String backupId;
    private final boolean successful;
    private final boolean automated;
    private final String errorMessage;

    public BackupCompletedEvent(Object source, String jobId, String backupId, boolean successful,
                                boolean automated, String errorMessage) {
        super(source);
        this.jobId = jobId;
        this.backupId = backupId;
        this.successful = successful;
        this.automated = automated;
        this.errorMessage = errorMessage;
    }
}
