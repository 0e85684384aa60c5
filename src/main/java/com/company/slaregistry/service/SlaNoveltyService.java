package com.company.slaregistry.service;

import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.domain.enums.ComparatorKind;
import com.company.slaregistry.domain.enums.SlaStatus;
import com.company.slaregistry.event.NoveltyAppliedEvent;
import com.company.slaregistry.event.SlaStatusChangedEvent;
import com.company.slaregistry.exception.InvalidArgumentException;
import com.company.slaregistry.exception.InvalidReferenceException;
import com.company.slaregistry.exception.SlaNotActiveException;
import com.company.slaregistry.exception.SlaNotPausedException;
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
 * Out-of-band adjustments ("novelties") to an SLA: pause, resume, retarget, reparametrize.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaNoveltyService {

    static final String FIELD_STATUS = "status";
    static final String FIELD_TARGET = "target";
    static final String FIELD_PARAMS = "comparator|window";

    private final EntityStore store;
    private final CapabilityGuard capabilityGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Sla pauseSla(Long slaId, String reason) {
        capabilityGuard.require(Capability.NOVELTY);

        Instant now = clock.instant();
        Sla sla = store.inTransaction(() -> {
            Sla current = requireSla(slaId);
            if (current.getStatus() != SlaStatus.ACTIVE) {
                throw new SlaNotActiveException(slaId, current.getStatus());
            }
            return changeStatus(slaId, SlaStatus.PAUSED, now);
        });

        publishStatusChange(sla, reason);
        log.info("SLA {} paused: {}", slaId, reason);
        return sla;
    }

    public Sla resumeSla(Long slaId, String reason) {
        capabilityGuard.require(Capability.NOVELTY);

        Instant now = clock.instant();
        Sla sla = store.inTransaction(() -> {
            Sla current = requireSla(slaId);
            if (current.getStatus() != SlaStatus.PAUSED) {
                throw new SlaNotPausedException(slaId, current.getStatus());
            }
            return changeStatus(slaId, SlaStatus.ACTIVE, now);
        });

        publishStatusChange(sla, reason);
        log.info("SLA {} resumed: {}", slaId, reason);
        return sla;
    }

    /**
     * Overwrite the target regardless of status. Counters are kept.
     */
    public Sla updateSlaTarget(Long slaId, long newTarget, String reason) {
        capabilityGuard.require(Capability.NOVELTY);

        Instant now = clock.instant();
        Sla sla = store.updateSla(slaId, s -> {
                    s.setTarget(newTarget);
                    s.setUpdatedAt(now);
                })
                .orElseThrow(() -> new InvalidReferenceException("SLA", slaId));

        publishNovelty(slaId, FIELD_TARGET, reason);
        log.info("SLA {} target set to {}: {}", slaId, newTarget, reason);
        return sla;
    }

    /**
     * Overwrite comparator and window regardless of status. Counters are kept.
     */
    public Sla updateSlaParams(Long slaId, ComparatorKind newComparator, long newWindowSeconds, String reason) {
        capabilityGuard.require(Capability.NOVELTY);

        if (newComparator == null) {
            throw new InvalidArgumentException("Comparator is required");
        }
        if (newWindowSeconds < 0) {
            throw new InvalidArgumentException("SLA window must not be negative");
        }

        Instant now = clock.instant();
        Sla sla = store.updateSla(slaId, s -> {
                    s.setComparator(newComparator);
                    s.setWindowSeconds(newWindowSeconds);
                    s.setUpdatedAt(now);
                })
                .orElseThrow(() -> new InvalidReferenceException("SLA", slaId));

        publishNovelty(slaId, FIELD_PARAMS, reason);
        log.info("SLA {} rule set to observed {} target, window {}s: {}",
                slaId, newComparator.getSymbol(), newWindowSeconds, reason);
        return sla;
    }

    private Sla requireSla(Long slaId) {
        return store.findSlaById(slaId)
                .orElseThrow(() -> new InvalidReferenceException("SLA", slaId));
    }

    private Sla changeStatus(Long slaId, SlaStatus status, Instant now) {
        return store.updateSla(slaId, s -> {
                    s.setStatus(status);
                    s.setUpdatedAt(now);
                })
                .orElseThrow(() -> new InvalidReferenceException("SLA", slaId));
    }

    private void publishStatusChange(Sla sla, String reason) {
        eventPublisher.publishEvent(new SlaStatusChangedEvent(sla.getSlaId(), sla.getStatus()));
        publishNovelty(sla.getSlaId(), FIELD_STATUS, reason);
    }

    private void publishNovelty(Long slaId, String field, String detail) {
        eventPublisher.publishEvent(new NoveltyAppliedEvent(slaId, field, detail));
        meterRegistry.counter("sla.novelties.applied", "field", field).increment();
    }
}
