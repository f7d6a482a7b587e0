package com.drautomation.api.client;

import com.drautomation.api.config.AutomationProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Drives services through the restart and health URLs configured under {@code automation.services}.
 */
@Slf4j
@Component
public class HttpServiceControlClient implements ServiceControlClient {

    private final AutomationProperties properties;
    private final RestTemplate restTemplate;

    @Autowired
    public HttpServiceControlClient(AutomationProperties properties) {
        this(properties, new RestTemplate());
    }

    HttpServiceControlClient(AutomationProperties properties, RestTemplate restTemplate) {
        this.properties = properties;
        this.restTemplate = restTemplate;
    }

    @Override
    public boolean isManaged(String service) {
        return properties.getServices().containsKey(service);
    }

    @Override
    @CircuitBreaker(name = "serviceControl")
    @Retry(name = "serviceControl")
    public void restartService(String service) {
        AutomationProperties.ServiceEndpoint endpoint = endpoint(service);
        if (endpoint.getRestartUrl() == null || endpoint.getRestartUrl().isBlank()) {
            throw new IllegalStateException("No restart URL configured for service " + service);
        }
        log.info("Restarting service {}", service);
        restTemplate.exchange(endpoint.getRestartUrl(), HttpMethod.POST, null, Void.class);
    }

    @Override
    public boolean isHealthy(String service) {
        AutomationProperties.ServiceEndpoint endpoint = endpoint(service);
        if (endpoint.getHealthUrl() == null || endpoint.getHealthUrl().isBlank()) {
            return true;
        }
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(endpoint.getHealthUrl(), String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.warn("Health check for service {} failed: {}", service, e.getMessage());
            return false;
        }
    }

    private AutomationProperties.ServiceEndpoint endpoint(String service) {
        AutomationProperties.ServiceEndpoint endpoint = properties.getServices().get(service);
        if (endpoint == null) {
            throw new IllegalArgumentException("Unknown service: " + service);
        }
        return endpoint;
    }
}
