package com.company.slaregistry.service;

import com.company.slaregistry.domain.Alert;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.domain.enums.AlertStatus;
import com.company.slaregistry.domain.enums.ComparatorKind;
import com.company.slaregistry.event.MetricReportedEvent;
import com.company.slaregistry.event.SlaViolatedEvent;
import com.company.slaregistry.exception.CapabilityDeniedException;
import com.company.slaregistry.exception.InvalidReferenceException;
import com.company.slaregistry.exception.SlaNotActiveException;
import com.company.slaregistry.security.Capability;
import com.company.slaregistry.util.ComparatorEvaluator;
import com.company.slaregistry.util.EvaluationOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class MetricEvaluationServiceTest {

    RegistryFixture fx;

    @BeforeEach
    void setup() {
        fx = new RegistryFixture();
    }

    @Test
    void deliveryTimeScenario() {
        Sla sla = fx.sla(24, ComparatorKind.LE);

        EvaluationOutcome onTime = fx.evaluation.reportMetric(sla.getSlaId(), 20, "batch 1");
        assertTrue(onTime.isSuccess());
        assertNull(onTime.getAlertId());

        EvaluationOutcome late = fx.evaluation.reportMetric(sla.getSlaId(), 36, "shipment late");
        assertFalse(late.isSuccess());
        assertEquals(1L, late.getAlertId());
        assertEquals(1, late.getConsecutiveBreaches());

        EvaluationOutcome recovered = fx.evaluation.reportMetric(sla.getSlaId(), 10, "batch 3");
        assertTrue(recovered.isSuccess());

        Sla stored = fx.query.getSla(sla.getSlaId());
        assertEquals(0, stored.getConsecutiveBreaches());
        assertEquals(1, stored.getTotalBreaches());
        assertEquals(2, stored.getTotalPass());
        assertEquals(3, stored.getTotalReports());
        assertEquals(RegistryFixture.NOW, stored.getLastReportAt());

        assertEquals(List.of(1L), fx.query.getSlaAlerts(sla.getSlaId()));
        Alert alert = fx.query.getAlert(1L);
        assertEquals(AlertStatus.OPEN, alert.getStatus());
        assertEquals(sla.getSlaId(), alert.getSlaId());
        assertEquals("shipment late", alert.getReason());
        assertEquals(RegistryFixture.NOW, alert.getCreatedAt());
    }

    @Test
    void publishesReportEventAndViolationOnlyOnBreach() {
        Sla sla = fx.sla(24, ComparatorKind.LE);

        fx.evaluation.reportMetric(sla.getSlaId(), 20, "ok");
        fx.evaluation.reportMetric(sla.getSlaId(), 36, "late");

        List<MetricReportedEvent> reports = fx.eventsOf(MetricReportedEvent.class);
        assertEquals(2, reports.size());
        assertTrue(reports.get(0).isSuccess());
        assertFalse(reports.get(1).isSuccess());
        assertEquals(36L, reports.get(1).getObserved());

        List<SlaViolatedEvent> violations = fx.eventsOf(SlaViolatedEvent.class);
        assertEquals(1, violations.size());
        assertEquals(1L, violations.get(0).getAlertId());
        assertEquals("late", violations.get(0).getReason());

        // violation follows its report
        assertInstanceOf(SlaViolatedEvent.class, fx.events.get(fx.events.size() - 1));

        assertEquals(1.0, fx.counter("sla.alerts.raised"));
        assertEquals(1.0, fx.counter("sla.metrics.reported", "comparator", "LE", "success", "false"));
    }

    @Test
    void missingNoteBecomesEmptyReason() {
        Sla sla = fx.sla(0, ComparatorKind.EQ);

        EvaluationOutcome outcome = fx.evaluation.reportMetric(sla.getSlaId(), 3, null);

        assertEquals("", fx.query.getAlert(outcome.getAlertId()).getReason());
    }

    @Test
    void consecutiveBreachesAccumulateUntilPass() {
        Sla sla = fx.sla(99, ComparatorKind.GE);

        fx.evaluation.reportMetric(sla.getSlaId(), 97, "a");
        fx.evaluation.reportMetric(sla.getSlaId(), 98, "b");
        EvaluationOutcome third = fx.evaluation.reportMetric(sla.getSlaId(), 50, "c");

        assertEquals(3, third.getConsecutiveBreaches());
        assertEquals(List.of(1L, 2L, 3L), fx.query.getSlaAlerts(sla.getSlaId()));

        EvaluationOutcome pass = fx.evaluation.reportMetric(sla.getSlaId(), 99, "d");
        assertEquals(0, pass.getConsecutiveBreaches());
        assertEquals(3, pass.getTotalBreaches());
    }

    @Test
    void countersMatchReportHistory() {
        Sla sla = fx.sla(50, ComparatorKind.LT);
        Random random = new Random(7);
        int passes = 0;
        int breaches = 0;
        int run = 0;

        for (int i = 0; i < 200; i++) {
            long observed = random.nextInt(100);
            fx.evaluation.reportMetric(sla.getSlaId(), observed, "r" + i);
            if (ComparatorEvaluator.evaluate(observed, 50, ComparatorKind.LT)) {
                passes++;
                run = 0;
            } else {
                breaches++;
                run++;
            }
        }

        Sla stored = fx.query.getSla(sla.getSlaId());
        assertEquals(passes, stored.getTotalPass());
        assertEquals(breaches, stored.getTotalBreaches());
        assertEquals(run, stored.getConsecutiveBreaches());
        assertEquals(breaches, fx.query.getSlaAlerts(sla.getSlaId()).size());
    }

    @Test
    void unknownSlaIsRejected() {
        assertThrows(InvalidReferenceException.class, () -> fx.evaluation.reportMetric(5L, 1, "x"));
        assertTrue(fx.events.isEmpty());
        assertTrue(fx.store.findAlertById(1L).isEmpty());
    }

    @Test
    void pausedSlaRejectsReportsWithoutSideEffects() {
        Sla sla = fx.sla(24, ComparatorKind.LE);
        fx.novelty.pauseSla(sla.getSlaId(), "maintenance");
        fx.events.clear();

        assertThrows(SlaNotActiveException.class, () -> fx.evaluation.reportMetric(sla.getSlaId(), 36, "late"));

        Sla stored = fx.query.getSla(sla.getSlaId());
        assertEquals(0, stored.getTotalReports());
        assertNull(stored.getLastReportAt());
        assertEquals(List.of(), fx.query.getSlaAlerts(sla.getSlaId()));
        assertTrue(fx.events.isEmpty());
    }

    @Test
    void resumedSlaEvaluatesAgain() {
        Sla sla = fx.sla(24, ComparatorKind.LE);
        fx.novelty.pauseSla(sla.getSlaId(), "maintenance");
        fx.novelty.resumeSla(sla.getSlaId(), "back");

        EvaluationOutcome outcome = fx.evaluation.reportMetric(sla.getSlaId(), 36, "late");

        assertFalse(outcome.isSuccess());
        assertEquals(1, fx.query.getSla(sla.getSlaId()).getTotalBreaches());
    }

    @Test
    void deniedCallerCannotReport() {
        Sla sla = fx.sla(24, ComparatorKind.LE);
        fx.deny(Capability.REGISTRATION);

        assertThrows(CapabilityDeniedException.class, () -> fx.evaluation.reportMetric(sla.getSlaId(), 36, "late"));
        // denial is checked before existence
        assertThrows(CapabilityDeniedException.class, () -> fx.evaluation.reportMetric(99L, 36, "late"));

        assertEquals(0, fx.query.getSla(sla.getSlaId()).getTotalReports());
    }

    @Test
    void concurrentReportsAreEachCountedOnce() throws Exception {
        Sla sla = fx.sla(10, ComparatorKind.LE);
        int threads = 8;
        int perThread = 100;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int offset = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        // even threads pass, odd threads breach
                        fx.evaluation.reportMetric(sla.getSlaId(), offset % 2 == 0 ? 5 : 15, "t" + offset);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Sla stored = fx.query.getSla(sla.getSlaId());
        assertEquals(threads * perThread, stored.getTotalReports());
        assertEquals(threads / 2 * perThread, stored.getTotalBreaches());
        assertEquals(stored.getTotalBreaches(), fx.query.getSlaAlerts(sla.getSlaId()).size());
    }
}
