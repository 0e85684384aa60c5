package com.company.slaregistry.util;

import com.company.slaregistry.domain.enums.ComparatorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Result of a single metric report against an SLA
 */
@Data
@Builder
@AllArgsConstructor
public class EvaluationOutcome {
    private Long slaId;
    private long observed;
    private long target;
    private ComparatorKind comparator;
    private boolean success;

    // Set only when the report breached the SLA
    private Long alertId;

    private int consecutiveBreaches;
    private int totalBreaches;
    private int totalPass;
    private Instant reportedAt;

    public boolean isBreached() {
        return !success;
    }
}
