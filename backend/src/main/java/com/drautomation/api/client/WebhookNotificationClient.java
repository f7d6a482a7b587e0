package com.drautomation.api.client;

import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.model.dto.NotificationMessage;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Posts notifications to the configured webhook. Without a webhook URL messages are only logged.
 */
@Slf4j
@Component
public class WebhookNotificationClient implements NotificationClient {

    private final AutomationProperties properties;
    private final RestTemplate restTemplate;

    @Autowired
    public WebhookNotificationClient(AutomationProperties properties) {
        this(properties, new RestTemplate());
    }

    WebhookNotificationClient(AutomationProperties properties, RestTemplate restTemplate) {
        this.properties = properties;
        this.restTemplate = restTemplate;
    }

    @Override
    @CircuitBreaker(name = "notifications")
    @Retry(name = "notifications")
    public void send(NotificationMessage message) {
        String webhookUrl = properties.getNotifications().getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("Notification [{}] (no webhook configured): {}", message.getType(), message.getData());
            return;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        restTemplate.exchange(webhookUrl, HttpMethod.POST, new HttpEntity<>(message, headers), Void.class);
        log.debug("Notification [{}] delivered to webhook", message.getType());
    }
}
