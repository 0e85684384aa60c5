package com.company.slaregistry.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Raised once per breaching metric report, after the alert has been stored.
 * Notification dispatch subscribes to this event.
 */
@Getter
@AllArgsConstructor
public class SlaViolatedEvent {
    private final Long alertId;
    private final Long slaId;
    private final String reason;
}
