package com.company.slaregistry.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AlertAcknowledgedEvent {
    private final Long alertId;
    private final String actor;
}
