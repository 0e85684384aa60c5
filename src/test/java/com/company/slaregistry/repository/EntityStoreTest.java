package com.company.slaregistry.repository;

import com.company.slaregistry.domain.Alert;
import com.company.slaregistry.domain.Client;
import com.company.slaregistry.domain.Contract;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.domain.enums.AlertStatus;
import com.company.slaregistry.domain.enums.ComparatorKind;
import com.company.slaregistry.domain.enums.SlaStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class EntityStoreTest {

    EntityStore store;

    @BeforeEach
    void setup() {
        store = new EntityStore();
    }

    @Test
    void clientIdsAreSequentialFromOne() {
        for (int i = 1; i <= 5; i++) {
            Client client = store.insertClient(Client.builder().name("Client " + i).active(true).build());
            assertEquals((long) i, client.getClientId());
        }
    }

    @Test
    void eachEntityTypeHasItsOwnSequence() {
        Client client = store.insertClient(Client.builder().name("Acme").active(true).build());
        Contract first = store.insertContract(Contract.builder().clientId(client.getClientId()).active(true).build());
        Contract second = store.insertContract(Contract.builder().clientId(client.getClientId()).active(true).build());
        Sla sla = store.insertSla(sla(first.getContractId()));

        assertEquals(1L, client.getClientId());
        assertEquals(1L, first.getContractId());
        assertEquals(2L, second.getContractId());
        assertEquals(1L, sla.getSlaId());
    }

    @Test
    void separateStoresNeverShareCounters() {
        EntityStore other = new EntityStore();
        store.insertClient(Client.builder().name("A").active(true).build());
        store.insertClient(Client.builder().name("B").active(true).build());

        assertEquals(1L, other.insertClient(Client.builder().name("C").active(true).build()).getClientId());
    }

    @Test
    void missingIdsAreReportedAsEmpty() {
        assertTrue(store.findClientById(1L).isEmpty());
        assertTrue(store.findContractById(1L).isEmpty());
        assertTrue(store.findSlaById(1L).isEmpty());
        assertTrue(store.findAlertById(1L).isEmpty());
        assertTrue(store.findContractByExternalId("CTR-1").isEmpty());
        assertTrue(store.updateSla(1L, s -> s.setTarget(5L)).isEmpty());
    }

    @Test
    void indexesKeepCreationOrder() {
        Client client = store.insertClient(Client.builder().name("Acme").active(true).build());
        Contract contract = store.insertContract(Contract.builder().clientId(client.getClientId()).active(true).build());
        Sla s1 = store.insertSla(sla(contract.getContractId()));
        Sla s2 = store.insertSla(sla(contract.getContractId()));
        Alert a1 = store.insertAlert(Alert.builder().slaId(s2.getSlaId()).status(AlertStatus.OPEN).build());
        Alert a2 = store.insertAlert(Alert.builder().slaId(s2.getSlaId()).status(AlertStatus.OPEN).build());

        assertEquals(List.of(contract.getContractId()), store.findContractIdsByClientId(client.getClientId()));
        assertEquals(List.of(s1.getSlaId(), s2.getSlaId()), store.findSlaIdsByContractId(contract.getContractId()));
        assertEquals(List.of(a1.getAlertId(), a2.getAlertId()), store.findAlertIdsBySlaId(s2.getSlaId()));
        assertEquals(List.of(), store.findAlertIdsBySlaId(s1.getSlaId()));
        assertEquals(List.of(), store.findSlaIdsByContractId(99L));
    }

    @Test
    void returnedIndexIsSnapshot() {
        Client client = store.insertClient(Client.builder().name("Acme").active(true).build());
        store.insertContract(Contract.builder().clientId(client.getClientId()).active(true).build());

        List<Long> snapshot = store.findContractIdsByClientId(client.getClientId());
        store.insertContract(Contract.builder().clientId(client.getClientId()).active(true).build());

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(7L));
    }

    @Test
    void callersCannotMutateStoredRecords() {
        Client client = store.insertClient(Client.builder().name("Acme").active(true).build());
        Contract contract = store.insertContract(Contract.builder().clientId(client.getClientId()).active(true).build());
        Sla sla = store.insertSla(sla(contract.getContractId()));

        sla.setTotalPass(100);
        store.findSlaById(sla.getSlaId()).orElseThrow().setStatus(SlaStatus.PAUSED);

        Sla stored = store.findSlaById(sla.getSlaId()).orElseThrow();
        assertEquals(0, stored.getTotalPass());
        assertEquals(SlaStatus.ACTIVE, stored.getStatus());
    }

    @Test
    void updateAppliesMutationToStoredRecord() {
        Client client = store.insertClient(Client.builder().name("Acme").active(true).build());
        Contract contract = store.insertContract(Contract.builder().clientId(client.getClientId()).active(true).build());
        Sla sla = store.insertSla(sla(contract.getContractId()));

        Sla updated = store.updateSla(sla.getSlaId(), s -> s.setTotalBreaches(s.getTotalBreaches() + 1)).orElseThrow();

        assertEquals(1, updated.getTotalBreaches());
        assertEquals(1, store.findSlaById(sla.getSlaId()).orElseThrow().getTotalBreaches());
    }

    @Test
    void externalIdLookup() {
        Client client = store.insertClient(Client.builder().name("Acme").active(true).build());
        Contract contract = store.insertContract(Contract.builder()
                .clientId(client.getClientId()).externalId("CTR-2024-001").active(true).build());
        store.insertContract(Contract.builder().clientId(client.getClientId()).externalId(" ").active(true).build());

        assertEquals(contract.getContractId(),
                store.findContractByExternalId("CTR-2024-001").orElseThrow().getContractId());
        assertTrue(store.findContractByExternalId(" ").isEmpty());
        assertTrue(store.findContractByExternalId(null).isEmpty());
    }

    @Test
    void countsByStatus() {
        Client client = store.insertClient(Client.builder().name("Acme").active(true).build());
        Contract contract = store.insertContract(Contract.builder().clientId(client.getClientId()).active(true).build());
        Sla sla = store.insertSla(sla(contract.getContractId()));
        store.insertSla(sla(contract.getContractId()).toBuilder().status(SlaStatus.PAUSED).build());
        store.insertAlert(Alert.builder().slaId(sla.getSlaId()).status(AlertStatus.OPEN).build());
        store.insertAlert(Alert.builder().slaId(sla.getSlaId()).status(AlertStatus.RESOLVED).build());

        assertEquals(1, store.countSlasByStatus(SlaStatus.ACTIVE));
        assertEquals(1, store.countSlasByStatus(SlaStatus.PAUSED));
        assertEquals(1, store.countAlertsByStatus(AlertStatus.OPEN));
        assertEquals(0, store.countAlertsByStatus(AlertStatus.ACKNOWLEDGED));
    }

    @Test
    void concurrentInsertsYieldUniqueGaplessIds() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(store.insertClient(Client.builder().name("c").active(true).build()).getClientId());
                    }
                    return ids;
                }));
            }

            Set<Long> all = new HashSet<>();
            for (Future<List<Long>> future : futures) {
                all.addAll(future.get(30, TimeUnit.SECONDS));
            }

            assertEquals(threads * perThread, all.size());
            assertEquals(1L, all.stream().mapToLong(Long::longValue).min().orElseThrow());
            assertEquals((long) threads * perThread, all.stream().mapToLong(Long::longValue).max().orElseThrow());
        } finally {
            executor.shutdownNow();
        }
    }

    private static Sla sla(Long contractId) {
        return Sla.builder()
                .contractId(contractId)
                .name("Delivery time")
                .target(24L)
                .comparator(ComparatorKind.LE)
                .status(SlaStatus.ACTIVE)
                .windowSeconds(0L)
                .consecutiveBreaches(0)
                .totalBreaches(0)
                .totalPass(0)
                .build();
    }
}
