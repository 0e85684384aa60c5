package com.company.slaregistry.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ContractCreatedEvent {
    private final Long contractId;
    private final Long clientId;
    private final String documentRef;
    private final int slaCount;
}
