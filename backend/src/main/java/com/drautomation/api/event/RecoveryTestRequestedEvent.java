package com.drautomation.api.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class RecoveryTestRequestedEvent extends ApplicationEvent {

    private final String testId;

    public RecoveryTestRequestedEvent(Object source, String testId) {
        super(source);
        this.testId = testId;
    }
}
