package com.company.slaregistry.service;

import com.company.slaregistry.domain.Alert;
import com.company.slaregistry.domain.enums.AlertStatus;
import com.company.slaregistry.event.AlertAcknowledgedEvent;
import com.company.slaregistry.event.AlertResolvedEvent;
import com.company.slaregistry.exception.AlertNotOpenException;
import com.company.slaregistry.exception.AlertNotResolvableException;
import com.company.slaregistry.exception.InvalidReferenceException;
import com.company.slaregistry.repository.EntityStore;
import com.company.slaregistry.security.Capability;
import com.company.slaregistry.security.CapabilityGuard;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * OPEN -> ACKNOWLEDGED -> RESOLVED, with OPEN -> RESOLVED allowed directly.
 * RESOLVED is terminal.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertLifecycleService {

    private final EntityStore store;
    private final CapabilityGuard capabilityGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Alert acknowledgeAlert(Long alertId, String actor) {
        capabilityGuard.require(Capability.OPERATIONS);

        Instant now = clock.instant();
        Alert alert = store.inTransaction(() -> {
            Alert current = requireAlert(alertId);
            if (!current.getStatus().canAcknowledge()) {
                throw new AlertNotOpenException(alertId, current.getStatus());
            }
            return store.updateAlert(alertId, a -> {
                        a.setStatus(AlertStatus.ACKNOWLEDGED);
                        a.setAcknowledgedBy(actor);
                        a.setAcknowledgedAt(now);
                    })
                    .orElseThrow(() -> new InvalidReferenceException("Alert", alertId));
        });

        eventPublisher.publishEvent(new AlertAcknowledgedEvent(alertId, actor));
        meterRegistry.counter("sla.alerts.acknowledged").increment();

        log.info("Alert {} acknowledged by {}", alertId, actor);
        return alert;
    }

    public Alert resolveAlert(Long alertId, String actor, String resolutionNote) {
        capabilityGuard.require(Capability.OPERATIONS);

        String note = resolutionNote != null ? resolutionNote : "";
        Instant now = clock.instant();

        Alert alert = store.inTransaction(() -> {
            Alert current = requireAlert(alertId);
            if (!current.getStatus().canResolve()) {
                throw new AlertNotResolvableException(alertId, current.getStatus());
            }
            return store.updateAlert(alertId, a -> {
                        a.setStatus(AlertStatus.RESOLVED);
                        a.setResolvedBy(actor);
                        a.setResolvedAt(now);
                        a.setResolutionNote(note);
                    })
                    .orElseThrow(() -> new InvalidReferenceException("Alert", alertId));
        });

        eventPublisher.publishEvent(new AlertResolvedEvent(alertId, actor, note));
        meterRegistry.counter("sla.alerts.resolved").increment();

        log.info("Alert {} resolved by {}", alertId, actor);
        return alert;
    }

    private Alert requireAlert(Long alertId) {
        return store.findAlertById(alertId)
                .orElseThrow(() -> new InvalidReferenceException("Alert", alertId));
    }
}
