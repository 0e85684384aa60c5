package com.company.slaregistry.domain;

import com.company.slaregistry.domain.enums.ComparatorKind;
import com.company.slaregistry.domain.enums.SlaStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * SLA term attached to a contract, with its running compliance counters.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Sla {
    private Long slaId;
    private Long contractId;

    private String name;
    private String description;

    // Rule: observed <comparator> target
    private Long target;
    private ComparatorKind comparator;
    private SlaStatus status;

    // Stored for schema compatibility, evaluation is always single-sample
    private Long windowSeconds;

    // Compliance counters
    private Instant lastReportAt;
    private Integer consecutiveBreaches;
    private Integer totalBreaches;
    private Integer totalPass;

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isActive() {
        return status == SlaStatus.ACTIVE;
    }

    /**
     * Number of evaluations recorded while the SLA was active
     */
    public int getTotalReports() {
        return (totalPass == null ? 0 : totalPass) + (totalBreaches == null ? 0 : totalBreaches);
    }
}
