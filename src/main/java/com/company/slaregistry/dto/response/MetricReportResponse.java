package com.company.slaregistry.dto.response;

import com.company.slaregistry.domain.enums.ComparatorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricReportResponse {
    private Long slaId;
    private Long observed;
    private Long target;
    private ComparatorKind comparator;
    private Boolean success;
    private Long alertId;
    private Integer consecutiveBreaches;
    private Integer totalBreaches;
    private Integer totalPass;
    private Instant reportedAt;
}
