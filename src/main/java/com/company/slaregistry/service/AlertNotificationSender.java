package com.company.slaregistry.service;

import com.company.slaregistry.domain.Alert;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.exception.AlertNotificationException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Hands SLA violations to the alerting backend as trace events.
 * Downstream alert rules fire on the sla.violation.alert span.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AlertNotificationSender {

    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    /**
     * Retry wraps the circuit breaker, so the fallback runs once, after the last attempt
     * or when the open breaker rejects the call.
     */
    @Retry(name = "alertNotification", fallbackMethod = "sendFallback")
    @CircuitBreaker(name = "alertNotification")
    public void send(Alert alert, Sla sla) {
        Span span = tracer.spanBuilder("sla.violation.alert")
            .setSpanKind(SpanKind.PRODUCER)
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("alert.id", alert.getAlertId());
            span.setAttribute("sla.id", sla.getSlaId());
            span.setAttribute("sla.name", sla.getName());
            span.setAttribute("contract.id", sla.getContractId());
            span.setAttribute("sla.consecutive_breaches", sla.getConsecutiveBreaches());

            span.addEvent("SLA Violated",
                Attributes.of(
                    AttributeKey.stringKey("reason"), alert.getReason(),
                    AttributeKey.stringKey("comparator"), sla.getComparator().name(),
                    AttributeKey.longKey("target"), sla.getTarget()
                ));

            meterRegistry.counter("sla.notifications.sent").increment();
            log.info("Violation notification sent for alert {} (SLA {})", alert.getAlertId(), sla.getSlaId());

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to send violation notification");
            throw new AlertNotificationException("Failed to send notification for alert " + alert.getAlertId(), e);
        } finally {
            span.end();
        }
    }

    /**
     * The alert itself is already stored; only the notification is lost
     */
    void sendFallback(Alert alert, Sla sla, Exception e) {
        log.error("Notification backend unavailable for alert {}: {}", alert.getAlertId(), e.getMessage());

        meterRegistry.counter("sla.notifications.failed",
                "sla", String.valueOf(sla.getSlaId())
        ).increment();
    }
}
