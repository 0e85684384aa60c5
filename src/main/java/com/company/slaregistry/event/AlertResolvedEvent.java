package com.company.slaregistry.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AlertResolvedEvent {
    private final Long alertId;
    private final String actor;
    private final String resolutionNote;
}
