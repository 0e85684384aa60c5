package com.company.slaregistry.controller;

import com.company.slaregistry.domain.Alert;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.dto.response.AlertResponse;
import com.company.slaregistry.dto.response.SlaResponse;
import com.company.slaregistry.service.RegistryQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
class RegistryResponseMapper {

    private final RegistryQueryService queryService;

    SlaResponse toSlaResponse(Sla sla) {
        return SlaResponse.builder()
                .slaId(sla.getSlaId())
                .contractId(sla.getContractId())
                .name(sla.getName())
                .description(sla.getDescription())
                .target(sla.getTarget())
                .comparator(sla.getComparator())
                .status(sla.getStatus())
                .windowSeconds(sla.getWindowSeconds())
                .lastReportAt(sla.getLastReportAt())
                .consecutiveBreaches(sla.getConsecutiveBreaches())
                .totalBreaches(sla.getTotalBreaches())
                .totalPass(sla.getTotalPass())
                .alertCount(queryService.getSlaAlerts(sla.getSlaId()).size())
                .build();
    }

    AlertResponse toAlertResponse(Alert alert) {
        return AlertResponse.builder()
                .alertId(alert.getAlertId())
                .slaId(alert.getSlaId())
                .status(alert.getStatus())
                .reason(alert.getReason())
                .createdAt(alert.getCreatedAt())
                .acknowledgedBy(alert.getAcknowledgedBy())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .resolvedBy(alert.getResolvedBy())
                .resolvedAt(alert.getResolvedAt())
                .resolutionNote(alert.getResolutionNote())
                .build();
    }
}
