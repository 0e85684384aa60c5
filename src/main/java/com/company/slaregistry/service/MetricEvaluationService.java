package com.company.slaregistry.service;

import com.company.slaregistry.domain.Alert;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.domain.enums.AlertStatus;
import com.company.slaregistry.event.MetricReportedEvent;
import com.company.slaregistry.event.SlaViolatedEvent;
import com.company.slaregistry.exception.InvalidReferenceException;
import com.company.slaregistry.exception.SlaNotActiveException;
import com.company.slaregistry.exception.SlaRegistryException;
import com.company.slaregistry.repository.EntityStore;
import com.company.slaregistry.security.Capability;
import com.company.slaregistry.security.CapabilityGuard;
import com.company.slaregistry.util.ComparatorEvaluator;
import com.company.slaregistry.util.EvaluationOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Evaluates metric reports against their SLA and raises an alert for every breach.
 *
 * <p>Each report is one atomic transition of the SLA: counters, lastReportAt and,
 * on a breach, the new alert and its index entry are applied together or not at all.
 * Events are published only after the transition is stored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricEvaluationService {

    private final EntityStore store;
    private final CapabilityGuard capabilityGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;
    private final Clock clock;

    public EvaluationOutcome reportMetric(Long slaId, long observed, String note) {
        capabilityGuard.require(Capability.REGISTRATION);

        String reason = note != null ? note : "";

        Span span = tracer.spanBuilder("sla.metric.evaluate")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("sla.id", slaId);
            span.setAttribute("sla.observed", observed);

            EvaluationOutcome outcome = store.inTransaction(() -> evaluateAndRecord(slaId, observed, reason));

            span.setAttribute("sla.success", outcome.isSuccess());

            eventPublisher.publishEvent(new MetricReportedEvent(slaId, observed, outcome.isSuccess(), reason));

            meterRegistry.counter("sla.metrics.reported",
                    "comparator", outcome.getComparator().name(),
                    "success", String.valueOf(outcome.isSuccess())
            ).increment();

            if (outcome.isBreached()) {
                log.warn("SLA {} violated: {} (alert {}, {} consecutive breach(es))",
                        slaId,
                        ComparatorEvaluator.describe(observed, outcome.getTarget(), outcome.getComparator()),
                        outcome.getAlertId(),
                        outcome.getConsecutiveBreaches());

                eventPublisher.publishEvent(new SlaViolatedEvent(outcome.getAlertId(), slaId, reason));
                meterRegistry.counter("sla.alerts.raised").increment();
            } else {
                log.info("SLA {} passed: {}",
                        slaId, ComparatorEvaluator.describe(observed, outcome.getTarget(), outcome.getComparator()));
            }

            return outcome;

        } catch (SlaRegistryException e) {
            span.setStatus(StatusCode.ERROR, e.getErrorKind().name());
            log.warn("Metric report for SLA {} rejected: {}", slaId, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private EvaluationOutcome evaluateAndRecord(Long slaId, long observed, String reason) {
        Sla sla = store.findSlaById(slaId)
                .orElseThrow(() -> new InvalidReferenceException("SLA", slaId));

        if (!sla.getStatus().acceptsReports()) {
            throw new SlaNotActiveException(slaId, sla.getStatus());
        }

        boolean success = ComparatorEvaluator.evaluate(observed, sla.getTarget(), sla.getComparator());
        Instant now = clock.instant();

        Sla updated = store.updateSla(slaId, s -> {
                    s.setLastReportAt(now);
                    s.setUpdatedAt(now);
                    if (success) {
                        s.setConsecutiveBreaches(0);
                        s.setTotalPass(s.getTotalPass() + 1);
                    } else {
                        s.setConsecutiveBreaches(s.getConsecutiveBreaches() + 1);
                        s.setTotalBreaches(s.getTotalBreaches() + 1);
                    }
                })
                .orElseThrow(() -> new InvalidReferenceException("SLA", slaId));

        Long alertId = null;
        if (!success) {
            Alert alert = store.insertAlert(Alert.builder()
                    .slaId(slaId)
                    .createdAt(now)
                    .status(AlertStatus.OPEN)
                    .reason(reason)
                    .build());
            alertId = alert.getAlertId();
        }

        return EvaluationOutcome.builder()
                .slaId(slaId)
                .observed(observed)
                .target(updated.getTarget())
                .comparator(updated.getComparator())
                .success(success)
                .alertId(alertId)
                .consecutiveBreaches(updated.getConsecutiveBreaches())
                .totalBreaches(updated.getTotalBreaches())
                .totalPass(updated.getTotalPass())
                .reportedAt(now)
                .build();
    }
}
