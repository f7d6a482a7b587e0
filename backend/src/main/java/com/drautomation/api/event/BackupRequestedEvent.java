package com.drautomation.api.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a backup job is created and committed to the database.
 * Triggers async backup execution after transaction commit.
 */
@Getter
public class BackupRequestedEvent extends ApplicationEvent {

    private final String jobId;

    public BackupRequestedEvent(Object source, String jobId) {
        super(source);
        this.jobId = jobId;
    }
}
