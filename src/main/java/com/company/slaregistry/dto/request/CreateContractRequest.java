package com.company.slaregistry.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Request to create a contract, optionally together with its initial SLAs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateContractRequest {
    @NotNull(message = "Client ID is required")
    private Long clientId;

    @NotBlank(message = "Document reference is required")
    private String documentRef;

    // Optional fields
    private String externalId;
    private Instant startAt;
    private Instant endAt;

    @Valid
    private List<SlaDefinitionRequest> slas;
}
