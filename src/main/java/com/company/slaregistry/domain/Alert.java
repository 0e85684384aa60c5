package com.company.slaregistry.domain;

import com.company.slaregistry.domain.enums.AlertStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    private Long alertId;
    private Long slaId;
    private Instant createdAt;
    private AlertStatus status;
    private String reason;

    // Lifecycle audit, written once by the matching transition
    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private String resolvedBy;
    private Instant resolvedAt;
    private String resolutionNote;
}
