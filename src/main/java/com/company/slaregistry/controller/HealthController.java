package com.company.slaregistry.controller;

import com.company.slaregistry.domain.enums.AlertStatus;
import com.company.slaregistry.domain.enums.SlaStatus;
import com.company.slaregistry.repository.EntityStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final EntityStore store;
    private final Clock clock;

    @Value("${spring.application.name:sla-registry-service}")
    private String serviceName;

    @GetMapping
    @Operation(summary = "Health check with ledger summary")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant());
        response.put("service", serviceName);
        response.put("activeSlas", store.countSlasByStatus(SlaStatus.ACTIVE));
        response.put("openAlerts", store.countAlertsByStatus(AlertStatus.OPEN));

        return ResponseEntity.ok(response);
    }
}
