package com.company.slaregistry.service;

import com.company.slaregistry.domain.Alert;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.event.SlaViolatedEvent;
import com.company.slaregistry.repository.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Subscriber of SLA violations. Runs off the reporting thread, so notification
 * problems never reach the caller that reported the metric.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertNotificationService {

    private final EntityStore store;
    private final AlertNotificationSender sender;

    @EventListener
    @Async
    public void handleSlaViolation(SlaViolatedEvent event) {
        Optional<Alert> alert = store.findAlertById(event.getAlertId());
        Optional<Sla> sla = store.findSlaById(event.getSlaId());

        if (alert.isEmpty() || sla.isEmpty()) {
            log.error("Violation event references unknown alert {} or SLA {}, notification skipped",
                    event.getAlertId(), event.getSlaId());
            return;
        }

        log.warn("Dispatching notification for alert {} on SLA {}: {}",
                event.getAlertId(), event.getSlaId(), event.getReason());

        sender.send(alert.get(), sla.get());
    }
}
