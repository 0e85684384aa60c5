package com.company.slaregistry.controller;

import com.company.slaregistry.domain.Alert;
import com.company.slaregistry.dto.request.ResolveAlertRequest;
import com.company.slaregistry.dto.response.AlertResponse;
import com.company.slaregistry.security.CallerContext;
import com.company.slaregistry.service.AlertLifecycleService;
import com.company.slaregistry.service.RegistryQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Alert lifecycle for the operations team. The acting operator is taken from the JWT.
 */
@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Acknowledge and resolve SLA violation alerts")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class AlertController {

    private final AlertLifecycleService lifecycleService;
    private final RegistryQueryService queryService;
    private final RegistryResponseMapper responseMapper;
    private final CallerContext callerContext;

    @GetMapping("/{alertId}")
    @Operation(summary = "Get an alert")
    public ResponseEntity<AlertResponse> getAlert(@PathVariable Long alertId) {
        return ResponseEntity.ok(responseMapper.toAlertResponse(queryService.getAlert(alertId)));
    }

    @PostMapping("/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge an open alert")
    public ResponseEntity<AlertResponse> acknowledge(@PathVariable Long alertId) {
        String actor = callerContext.getCurrentCallerDisplayName();

        Alert alert = lifecycleService.acknowledgeAlert(alertId, actor);
        return ResponseEntity.ok(responseMapper.toAlertResponse(alert));
    }

    @PostMapping("/{alertId}/resolve")
    @Operation(summary = "Resolve an open or acknowledged alert")
    public ResponseEntity<AlertResponse> resolve(
            @PathVariable Long alertId,
            @Valid @RequestBody(required = false) ResolveAlertRequest request) {

        String actor = callerContext.getCurrentCallerDisplayName();
        String note = request != null ? request.getResolutionNote() : null;

        Alert alert = lifecycleService.resolveAlert(alertId, actor, note);
        return ResponseEntity.ok(responseMapper.toAlertResponse(alert));
    }
}
