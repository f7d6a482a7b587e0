package com.drautomation.api.service;

import com.drautomation.api.client.NotificationClient;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.model.dto.NotificationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sends operator notifications. Delivery failures are logged and never affect the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationClient notificationClient;
    private final AutomationProperties properties;
    private final Clock clock;

    public void notify(String type, Map<String, Object> data) {
        notify(type, data, List.of());
    }

    public void notify(String type, Map<String, Object> data, List<String> extraRecipients) {
        if (!properties.getNotifications().isEnabled()) {
            log.debug("Notifications disabled, dropping {}", type);
            return;
        }
        Set<String> recipients = new LinkedHashSet<>(properties.getNotifications().getRecipients());
        if (extraRecipients != null) {
            recipients.addAll(extraRecipients);
        }
        NotificationMessage message = NotificationMessage.builder()
                .type(type)
                .timestamp(Instant.now(clock))
                .recipients(new ArrayList<>(recipients))
                .data(new LinkedHashMap<>(data))
                .build();
        try {
            notificationClient.send(message);
        } catch (Exception e) {
            log.warn("Failed to deliver {} notification: {}", type, e.getMessage());
        }
    }
}
