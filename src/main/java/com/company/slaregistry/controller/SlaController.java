package com.company.slaregistry.controller;

import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.dto.request.NoveltyRequest;
import com.company.slaregistry.dto.request.ReportMetricRequest;
import com.company.slaregistry.dto.request.UpdateParamsRequest;
import com.company.slaregistry.dto.request.UpdateTargetRequest;
import com.company.slaregistry.dto.response.MetricReportResponse;
import com.company.slaregistry.dto.response.SlaResponse;
import com.company.slaregistry.service.MetricEvaluationService;
import com.company.slaregistry.service.RegistryQueryService;
import com.company.slaregistry.service.SlaNoveltyService;
import com.company.slaregistry.util.EvaluationOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/slas")
@Tag(name = "SLAs", description = "Metric reporting and SLA novelties")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class SlaController {

    private final MetricEvaluationService evaluationService;
    private final SlaNoveltyService noveltyService;
    private final RegistryQueryService queryService;
    private final RegistryResponseMapper responseMapper;
    private final MeterRegistry meterRegistry;

    @GetMapping("/{slaId}")
    @Operation(summary = "Get an SLA with its compliance counters")
    public ResponseEntity<SlaResponse> getSla(@PathVariable Long slaId) {
        return ResponseEntity.ok(responseMapper.toSlaResponse(queryService.getSla(slaId)));
    }

    @GetMapping("/{slaId}/alerts")
    @Operation(summary = "List alert ids raised for an SLA in creation order")
    public ResponseEntity<List<Long>> getSlaAlerts(@PathVariable Long slaId) {
        return ResponseEntity.ok(queryService.getSlaAlerts(slaId));
    }

    @PostMapping("/{slaId}/metrics")
    @Operation(summary = "Report a metric observation",
            description = "Evaluates the observation against the SLA rule and raises an alert on breach")
    public ResponseEntity<MetricReportResponse> reportMetric(
            @PathVariable Long slaId,
            @Valid @RequestBody ReportMetricRequest request) {

        meterRegistry.counter("api.slas.metrics.requests").increment();

        EvaluationOutcome outcome = evaluationService.reportMetric(slaId, request.getObserved(), request.getNote());

        return ResponseEntity.ok(MetricReportResponse.builder()
                .slaId(outcome.getSlaId())
                .observed(outcome.getObserved())
                .target(outcome.getTarget())
                .comparator(outcome.getComparator())
                .success(outcome.isSuccess())
                .alertId(outcome.getAlertId())
                .consecutiveBreaches(outcome.getConsecutiveBreaches())
                .totalBreaches(outcome.getTotalBreaches())
                .totalPass(outcome.getTotalPass())
                .reportedAt(outcome.getReportedAt())
                .build());
    }

    @PostMapping("/{slaId}/pause")
    @Operation(summary = "Pause an active SLA")
    public ResponseEntity<SlaResponse> pauseSla(
            @PathVariable Long slaId,
            @Valid @RequestBody NoveltyRequest request) {

        Sla sla = noveltyService.pauseSla(slaId, request.getReason());
        return ResponseEntity.ok(responseMapper.toSlaResponse(sla));
    }

    @PostMapping("/{slaId}/resume")
    @Operation(summary = "Resume a paused SLA")
    public ResponseEntity<SlaResponse> resumeSla(
            @PathVariable Long slaId,
            @Valid @RequestBody NoveltyRequest request) {

        Sla sla = noveltyService.resumeSla(slaId, request.getReason());
        return ResponseEntity.ok(responseMapper.toSlaResponse(sla));
    }

    @PutMapping("/{slaId}/target")
    @Operation(summary = "Change the SLA target")
    public ResponseEntity<SlaResponse> updateTarget(
            @PathVariable Long slaId,
            @Valid @RequestBody UpdateTargetRequest request) {

        Sla sla = noveltyService.updateSlaTarget(slaId, request.getTarget(), request.getReason());
        return ResponseEntity.ok(responseMapper.toSlaResponse(sla));
    }

    @PutMapping("/{slaId}/params")
    @Operation(summary = "Change the SLA comparator and window")
    public ResponseEntity<SlaResponse> updateParams(
            @PathVariable Long slaId,
            @Valid @RequestBody UpdateParamsRequest request) {

        Sla sla = noveltyService.updateSlaParams(
                slaId, request.getComparator(), request.getWindowSeconds(), request.getReason());
        return ResponseEntity.ok(responseMapper.toSlaResponse(sla));
    }
}
