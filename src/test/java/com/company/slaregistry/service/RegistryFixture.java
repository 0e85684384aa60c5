package com.company.slaregistry.service;

import com.company.slaregistry.domain.Client;
import com.company.slaregistry.domain.Contract;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.domain.enums.ComparatorKind;
import com.company.slaregistry.dto.request.CreateContractRequest;
import com.company.slaregistry.dto.request.SlaDefinitionRequest;
import com.company.slaregistry.repository.EntityStore;
import com.company.slaregistry.security.CallerContext;
import com.company.slaregistry.security.Capability;
import com.company.slaregistry.security.CapabilityGuard;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry services wired by hand around one store, with captured events
 * and a capability set tests can narrow.
 */
class RegistryFixture {

    static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    final EntityStore store = new EntityStore();
    final List<Object> events = Collections.synchronizedList(new ArrayList<>());
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final Set<Capability> granted = EnumSet.allOf(Capability.class);

    final CapabilityGuard guard =
            new CapabilityGuard((caller, capability) -> granted.contains(capability), new CallerContext());

    final RegistrationService registration =
            new RegistrationService(store, guard, events::add, meterRegistry, clock);
    final MetricEvaluationService evaluation =
            new MetricEvaluationService(store, guard, events::add, meterRegistry,
                    OpenTelemetry.noop().getTracer("test"), clock);
    final SlaNoveltyService novelty =
            new SlaNoveltyService(store, guard, events::add, meterRegistry, clock);
    final AlertLifecycleService lifecycle =
            new AlertLifecycleService(store, guard, events::add, meterRegistry, clock);
    final RegistryQueryService query = new RegistryQueryService(store);

    void deny(Capability capability) {
        granted.remove(capability);
    }

    Client client() {
        return registration.registerClient("Acme", "owner-1");
    }

    Contract contract(Long clientId, SlaDefinitionRequest... slas) {
        return registration.createContract(CreateContractRequest.builder()
                .clientId(clientId)
                .documentRef("doc://contract")
                .slas(List.of(slas))
                .build());
    }

    /**
     * A fresh client, contract and single active SLA; captured events are cleared
     */
    Sla sla(long target, ComparatorKind comparator) {
        Contract contract = contract(client().getClientId());
        Sla sla = registration.addSla(contract.getContractId(), definition("Delivery time", target, comparator));
        events.clear();
        return sla;
    }

    static SlaDefinitionRequest definition(String name, long target, ComparatorKind comparator) {
        return SlaDefinitionRequest.builder()
                .name(name)
                .target(target)
                .comparator(comparator)
                .build();
    }

    <T> List<T> eventsOf(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    double counter(String name, String... tags) {
        return meterRegistry.counter(name, tags).count();
    }
}
