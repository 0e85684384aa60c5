package com.company.slaregistry.dto.response;

import com.company.slaregistry.domain.enums.ComparatorKind;
import com.company.slaregistry.domain.enums.SlaStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaResponse {
    private Long slaId;
    private Long contractId;
    private String name;
    private String description;
    private Long target;
    private ComparatorKind comparator;
    private SlaStatus status;
    private Long windowSeconds;
    private Instant lastReportAt;
    private Integer consecutiveBreaches;
    private Integer totalBreaches;
    private Integer totalPass;
    private Integer alertCount;
}
