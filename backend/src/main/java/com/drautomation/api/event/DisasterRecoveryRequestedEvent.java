package com.drautomation.api.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class DisasterRecoveryRequestedEvent extends ApplicationEvent {

    private final String executionId;

    public DisasterRecoveryRequestedEvent(Object source, String executionId) {
        super(source);
        this.executionId = executionId;
    }
}
