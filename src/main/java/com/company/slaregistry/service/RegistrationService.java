package com.company.slaregistry.service;

import com.company.slaregistry.domain.Client;
import com.company.slaregistry.domain.Contract;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.domain.enums.SlaStatus;
import com.company.slaregistry.dto.request.CreateContractRequest;
import com.company.slaregistry.dto.request.SlaDefinitionRequest;
import com.company.slaregistry.event.*;
import com.company.slaregistry.exception.DuplicateExternalIdException;
import com.company.slaregistry.exception.InvalidArgumentException;
import com.company.slaregistry.exception.InvalidReferenceException;
import com.company.slaregistry.repository.EntityStore;
import com.company.slaregistry.security.Capability;
import com.company.slaregistry.security.CapabilityGuard;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Creates clients, contracts and SLAs and wires the index relations between them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RegistrationService {

    private final EntityStore store;
    private final CapabilityGuard capabilityGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Client registerClient(String name, String ownerRef) {
        capabilityGuard.require(Capability.REGISTRATION);

        Client client = store.insertClient(Client.builder()
                .name(name)
                .ownerRef(ownerRef)
                .active(true)
                .createdAt(clock.instant())
                .build());

        eventPublisher.publishEvent(new ClientRegisteredEvent(client.getClientId()));
        meterRegistry.counter("sla.registry.clients.registered").increment();

        log.info("Client {} registered ({})", client.getClientId(), client.getName());
        return client;
    }

    /**
     * Create a contract and, in the same unit, every SLA listed in the request.
     * Either the contract and all its SLAs are stored or nothing is.
     */
    public Contract createContract(CreateContractRequest request) {
        capabilityGuard.require(Capability.REGISTRATION);

        List<SlaDefinitionRequest> definitions =
                request.getSlas() != null ? request.getSlas() : List.of();
        List<Sla> createdSlas = new ArrayList<>();
        Instant now = clock.instant();

        Contract contract = store.inTransaction(() -> {
            requireActiveClient(request.getClientId());
            validatePeriod(request.getStartAt(), request.getEndAt());
            requireUnusedExternalId(request.getExternalId());
            definitions.forEach(this::validateDefinition);

            Contract stored = store.insertContract(Contract.builder()
                    .clientId(request.getClientId())
                    .externalId(request.getExternalId())
                    .documentRef(request.getDocumentRef())
                    .active(true)
                    .startAt(request.getStartAt())
                    .endAt(request.getEndAt())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());

            for (SlaDefinitionRequest definition : definitions) {
                createdSlas.add(store.insertSla(newSla(stored.getContractId(), definition, now)));
            }
            return stored;
        });

        eventPublisher.publishEvent(new ContractCreatedEvent(
                contract.getContractId(),
                contract.getClientId(),
                contract.getDocumentRef(),
                createdSlas.size()));
        createdSlas.forEach(this::publishSlaCreated);

        meterRegistry.counter("sla.registry.contracts.created").increment();
        meterRegistry.counter("sla.registry.slas.created").increment(createdSlas.size());

        log.info("Contract {} created for client {} with {} SLA(s)",
                contract.getContractId(), contract.getClientId(), createdSlas.size());
        return contract;
    }

    public Sla addSla(Long contractId, SlaDefinitionRequest definition) {
        capabilityGuard.require(Capability.REGISTRATION);

        Instant now = clock.instant();
        Sla sla = store.inTransaction(() -> {
            requireActiveContract(contractId);
            validateDefinition(definition);
            return store.insertSla(newSla(contractId, definition, now));
        });

        publishSlaCreated(sla);
        meterRegistry.counter("sla.registry.slas.created").increment();

        log.info("SLA {} '{}' added to contract {} (rule: observed {} {})",
                sla.getSlaId(), sla.getName(), contractId,
                sla.getComparator().getSymbol(), sla.getTarget());
        return sla;
    }

    public Contract updateContractDocument(Long contractId, String documentRef) {
        capabilityGuard.require(Capability.REGISTRATION);

        if (documentRef == null || documentRef.isBlank()) {
            throw new InvalidArgumentException("Document reference must not be blank");
        }

        Instant now = clock.instant();
        Contract contract = store.updateContract(contractId, c -> {
                    c.setDocumentRef(documentRef);
                    c.setUpdatedAt(now);
                })
                .orElseThrow(() -> new InvalidReferenceException("Contract", contractId));

        eventPublisher.publishEvent(new ContractDocumentUpdatedEvent(contractId, documentRef));

        log.info("Contract {} document reference updated", contractId);
        return contract;
    }

    private void requireActiveClient(Long clientId) {
        Client client = store.findClientById(clientId)
                .orElseThrow(() -> new InvalidReferenceException("Client", clientId));

        if (!Boolean.TRUE.equals(client.getActive())) {
            throw new InvalidReferenceException("Client", clientId, "is not active");
        }
    }

    private void requireActiveContract(Long contractId) {
        Contract contract = store.findContractById(contractId)
                .orElseThrow(() -> new InvalidReferenceException("Contract", contractId));

        if (!Boolean.TRUE.equals(contract.getActive())) {
            throw new InvalidReferenceException("Contract", contractId, "is not active");
        }
    }

    private void requireUnusedExternalId(String externalId) {
        Optional<Contract> existing = store.findContractByExternalId(externalId);
        if (existing.isPresent()) {
            throw new DuplicateExternalIdException(externalId, existing.get().getContractId());
        }
    }

    private void validatePeriod(Instant startAt, Instant endAt) {
        if (startAt != null && endAt != null && endAt.isBefore(startAt)) {
            throw new InvalidArgumentException(
                    "Contract end " + endAt + " is before its start " + startAt);
        }
    }

    private void validateDefinition(SlaDefinitionRequest definition) {
        if (definition == null) {
            throw new InvalidArgumentException("SLA definition is required");
        }
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new InvalidArgumentException("SLA name must not be blank");
        }
        if (definition.getTarget() == null) {
            throw new InvalidArgumentException("SLA '" + definition.getName() + "' has no target");
        }
        if (definition.getComparator() == null) {
            throw new InvalidArgumentException("SLA '" + definition.getName() + "' has no comparator");
        }
        if (definition.getWindowSeconds() != null && definition.getWindowSeconds() < 0) {
            throw new InvalidArgumentException("SLA window must not be negative");
        }
    }

    private Sla newSla(Long contractId, SlaDefinitionRequest definition, Instant now) {
        return Sla.builder()
                .contractId(contractId)
                .name(definition.getName())
                .description(definition.getDescription())
                .target(definition.getTarget())
                .comparator(definition.getComparator())
                .status(SlaStatus.ACTIVE)
                .windowSeconds(definition.getWindowSeconds() != null ? definition.getWindowSeconds() : 0L)
                .consecutiveBreaches(0)
                .totalBreaches(0)
                .totalPass(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private void publishSlaCreated(Sla sla) {
        eventPublisher.publishEvent(new SlaCreatedEvent(
                sla.getSlaId(),
                sla.getContractId(),
                sla.getName(),
                sla.getTarget(),
                sla.getComparator(),
                sla.getWindowSeconds()));
    }
}
