package com.drautomation.api.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a restore job is created and committed to the database.
 */
@Getter
public class RestoreRequestedEvent extends ApplicationEvent {

    private final String restoreJobId;

    public RestoreRequestedEvent(Object source, String restoreJobId) {
        super(source);
        this.restoreJobId = restoreJobId;
    }
}
