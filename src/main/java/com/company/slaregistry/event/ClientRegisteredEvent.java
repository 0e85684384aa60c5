package com.company.slaregistry.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ClientRegisteredEvent {
    private final Long clientId;
}
