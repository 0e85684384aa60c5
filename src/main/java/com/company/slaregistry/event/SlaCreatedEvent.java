package com.company.slaregistry.event;

import com.company.slaregistry.domain.enums.ComparatorKind;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SlaCreatedEvent {
    private final Long slaId;
    private final Long contractId;
    private final String name;
    private final long target;
    private final ComparatorKind comparator;
    private final long windowSeconds;
}
