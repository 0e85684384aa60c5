package com.company.slaregistry.event;

import com.company.slaregistry.domain.enums.SlaStatus;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SlaStatusChangedEvent {
    private final Long slaId;
    private final SlaStatus newStatus;
}
