package com.drautomation.api.service;

import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.exception.ResourceNotFoundException;
import com.drautomation.api.model.dto.NotificationMessage;
import com.drautomation.api.model.entity.SystemAlert;
import com.drautomation.api.model.enums.AutomationComponent;
import com.drautomation.api.model.enums.Severity;
import com.drautomation.api.repository.SystemAlertRepository;
import com.drautomation.api.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * System alerts raised by health checks and failed operations.
 * A component has at most one open alert per severity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    private final SystemAlertRepository alertRepository;
    private final NotificationService notificationService;
    private final IdGenerator idGenerator;
    private final AutomationProperties properties;
    private final Clock clock;

    @Transactional
    public SystemAlert raise(AutomationComponent component, Severity severity, String message) {
        Optional<SystemAlert> existing = alertRepository.findByComponentAndResolvedAtIsNull(component).stream()
                .filter(a -> a.getSeverity() == severity)
                .findFirst();
        if (existing.isPresent()) {
            log.debug("Alert for {} at {} already open: {}", component, severity, existing.get().getId());
            return existing.get();
        }

        SystemAlert alert = alertRepository.save(SystemAlert.builder()
                .id(idGenerator.generate(IdGenerator.PREFIX_ALERT))
                .component(component)
                .severity(severity)
                .message(message)
                .createdAt(Instant.now(clock))
                .build());
        log.warn("Alert raised [{}] {}: {}", severity, component, message);

        if (properties.getMonitoring().isAlertNotifications()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("alertId", alert.getId());
            data.put("component", component.name());
            data.put("severity", severity.name());
            data.put("message", message);
            notificationService.notify(NotificationMessage.TYPE_SYSTEM_ALERT, data);
        }
        return alert;
    }

    @Transactional
    public SystemAlert acknowledge(String alertId) {
        SystemAlert alert = get(alertId);
        if (!alert.isAcknowledged()) {
            alert.setAcknowledged(true);
            alert.setAcknowledgedAt(Instant.now(clock));
            log.info("Alert {} acknowledged", alertId);
        }
        return alertRepository.save(alert);
    }

    @Transactional
    public SystemAlert resolve(String alertId) {
        SystemAlert alert = get(alertId);
        if (alert.isOpen()) {
            alert.setResolvedAt(Instant.now(clock));
            log.info("Alert {} resolved", alertId);
        }
        return alertRepository.save(alert);
    }

    /**
     * Resolves every open alert of {@code component}.
     *
     * @return number of alerts resolved
     */
    @Transactional
    public int resolveOpen(AutomationComponent component) {
        List<SystemAlert> open = alertRepository.findByComponentAndResolvedAtIsNull(component);
        Instant now = Instant.now(clock);
        open.forEach(a -> a.setResolvedAt(now));
        alertRepository.saveAll(open);
        if (!open.isEmpty()) {
            log.info("Resolved {} alerts for {}", open.size(), component);
        }
        return open.size();
    }

    @Transactional(readOnly = true)
    public List<SystemAlert> list(boolean openOnly) {
        return openOnly
                ? alertRepository.findByResolvedAtIsNullOrderByCreatedAtDesc()
                : alertRepository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public long countOpen() {
        return alertRepository.findByResolvedAtIsNullOrderByCreatedAtDesc().size();
    }

    private SystemAlert get(String alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
    }
}
