package com.drautomation.api.client;

import com.drautomation.api.model.dto.NotificationMessage;

public interface NotificationClient {

    void send(NotificationMessage message);
}
