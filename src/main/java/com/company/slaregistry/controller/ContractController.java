package com.company.slaregistry.controller;

import com.company.slaregistry.domain.Contract;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.dto.request.CreateContractRequest;
import com.company.slaregistry.dto.request.SlaDefinitionRequest;
import com.company.slaregistry.dto.request.UpdateDocumentRequest;
import com.company.slaregistry.dto.response.ContractResponse;
import com.company.slaregistry.dto.response.SlaResponse;
import com.company.slaregistry.service.RegistrationService;
import com.company.slaregistry.service.RegistryQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/v1/contracts")
@Tag(name = "Contracts", description = "Contracts and the SLAs attached to them")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class ContractController {

    private final RegistrationService registrationService;
    private final RegistryQueryService queryService;
    private final RegistryResponseMapper responseMapper;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Create a contract",
            description = "Optionally creates the listed SLAs in the same call, in list order")
    public ResponseEntity<ContractResponse> createContract(@Valid @RequestBody CreateContractRequest request) {
        meterRegistry.counter("api.contracts.create.requests",
                "batch", String.valueOf(request.getSlas() != null && !request.getSlas().isEmpty())
        ).increment();

        Contract contract = registrationService.createContract(request);

        return ResponseEntity
                .created(URI.create("/api/v1/contracts/" + contract.getContractId()))
                .body(toContractResponse(contract));
    }

    @GetMapping("/{contractId}")
    @Operation(summary = "Get a contract with its SLA ids")
    public ResponseEntity<ContractResponse> getContract(@PathVariable Long contractId) {
        return ResponseEntity.ok(toContractResponse(queryService.getContract(contractId)));
    }

    @GetMapping("/external/{externalId}")
    @Operation(summary = "Find a contract by the upstream system's id")
    public ResponseEntity<ContractResponse> getContractByExternalId(@PathVariable String externalId) {
        return ResponseEntity.ok(toContractResponse(queryService.getContractByExternalId(externalId)));
    }

    @PutMapping("/{contractId}/document")
    @Operation(summary = "Replace the contract document reference")
    public ResponseEntity<ContractResponse> updateDocument(
            @PathVariable Long contractId,
            @Valid @RequestBody UpdateDocumentRequest request) {

        Contract contract = registrationService.updateContractDocument(contractId, request.getDocumentRef());
        return ResponseEntity.ok(toContractResponse(contract));
    }

    @GetMapping("/{contractId}/slas")
    @Operation(summary = "List SLA ids of a contract in creation order")
    public ResponseEntity<List<Long>> getContractSlas(@PathVariable Long contractId) {
        return ResponseEntity.ok(queryService.getContractSlas(contractId));
    }

    @PostMapping("/{contractId}/slas")
    @Operation(summary = "Attach an SLA to an active contract")
    public ResponseEntity<SlaResponse> addSla(
            @PathVariable Long contractId,
            @Valid @RequestBody SlaDefinitionRequest request) {

        Sla sla = registrationService.addSla(contractId, request);

        return ResponseEntity
                .created(URI.create("/api/v1/slas/" + sla.getSlaId()))
                .body(responseMapper.toSlaResponse(sla));
    }

    private ContractResponse toContractResponse(Contract contract) {
        return ContractResponse.builder()
                .contractId(contract.getContractId())
                .clientId(contract.getClientId())
                .externalId(contract.getExternalId())
                .documentRef(contract.getDocumentRef())
                .active(contract.getActive())
                .startAt(contract.getStartAt())
                .endAt(contract.getEndAt())
                .createdAt(contract.getCreatedAt())
                .updatedAt(contract.getUpdatedAt())
                .slaIds(queryService.getContractSlas(contract.getContractId()))
                .build();
    }
}
