package com.company.slaregistry.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MetricReportedEvent {
    private final Long slaId;
    private final long observed;
    private final boolean success;
    private final String note;
}
