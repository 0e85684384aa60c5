package com.company.slaregistry.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Client {
    private Long clientId;
    private String name;
    private String ownerRef; // opaque identity of the owning account
    private Boolean active;
    private Instant createdAt;
}
