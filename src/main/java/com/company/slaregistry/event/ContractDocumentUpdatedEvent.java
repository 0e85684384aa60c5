package com.company.slaregistry.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ContractDocumentUpdatedEvent {
    private final Long contractId;
    private final String documentRef;
}
