package com.company.slaregistry.controller;

import com.company.slaregistry.domain.Client;
import com.company.slaregistry.dto.request.RegisterClientRequest;
import com.company.slaregistry.dto.response.ClientResponse;
import com.company.slaregistry.service.RegistrationService;
import com.company.slaregistry.service.RegistryQueryService;
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
@RequestMapping("/api/v1/clients")
@Tag(name = "Clients", description = "Client registration and lookup")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class ClientController {

    private final RegistrationService registrationService;
    private final RegistryQueryService queryService;

    @PostMapping
    @Operation(summary = "Register a client", description = "Requires the registration capability")
    public ResponseEntity<ClientResponse> registerClient(@Valid @RequestBody RegisterClientRequest request) {
        Client client = registrationService.registerClient(request.getName(), request.getOwnerRef());

        return ResponseEntity
                .created(URI.create("/api/v1/clients/" + client.getClientId()))
                .body(toClientResponse(client, List.of()));
    }

    @GetMapping("/{clientId}")
    @Operation(summary = "Get a client with its contract ids")
    public ResponseEntity<ClientResponse> getClient(@PathVariable Long clientId) {
        Client client = queryService.getClient(clientId);
        return ResponseEntity.ok(toClientResponse(client, queryService.getClientContracts(clientId)));
    }

    @GetMapping("/{clientId}/contracts")
    @Operation(summary = "List contract ids of a client in creation order")
    public ResponseEntity<List<Long>> getClientContracts(@PathVariable Long clientId) {
        return ResponseEntity.ok(queryService.getClientContracts(clientId));
    }

    private ClientResponse toClientResponse(Client client, List<Long> contractIds) {
        return ClientResponse.builder()
                .clientId(client.getClientId())
                .name(client.getName())
                .ownerRef(client.getOwnerRef())
                .active(client.getActive())
                .createdAt(client.getCreatedAt())
                .contractIds(contractIds)
                .build();
    }
}
