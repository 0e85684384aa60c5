package com.company.slaregistry.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Contract signed with a client. The document itself lives outside the registry,
 * only its reference (e.g. a content hash or storage path) is kept here.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Contract {
    private Long contractId;
    private Long clientId;

    // Correlation id from the upstream contract system, unique when present
    private String externalId;
    private String documentRef;

    private Boolean active;
    private Instant startAt;
    private Instant endAt;

    private Instant createdAt;
    private Instant updatedAt;
}
