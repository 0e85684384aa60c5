package com.company.slaregistry.repository;

import com.company.slaregistry.domain.Alert;
import com.company.slaregistry.domain.Client;
import com.company.slaregistry.domain.Contract;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.domain.enums.AlertStatus;
import com.company.slaregistry.domain.enums.SlaStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory ledger holding clients, contracts, SLAs and alerts.
 *
 * <p>One writer at a time: every insert and update, and every compound unit passed to
 * {@link #inTransaction(Supplier)}, runs under the write lock. Readers share the read lock
 * and always see fully applied transactions. Identifiers come from per-type sequences
 * owned by the instance, starting at 1 and never reused.
 *
 * <p>Records are copied on the way in and on the way out, so callers can never mutate
 * stored state except through the update methods.
 */
@Repository
@Slf4j
public class EntityStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Long, Client> clients = new HashMap<>();
    private final Map<Long, Contract> contracts = new HashMap<>();
    private final Map<Long, Sla> slas = new HashMap<>();
    private final Map<Long, Alert> alerts = new HashMap<>();

    // Append-only parent -> children indexes
    private final Map<Long, List<Long>> contractIdsByClient = new HashMap<>();
    private final Map<Long, List<Long>> slaIdsByContract = new HashMap<>();
    private final Map<Long, List<Long>> alertIdsBySla = new HashMap<>();
    private final Map<String, Long> contractIdsByExternalId = new HashMap<>();

    private long clientSequence;
    private long contractSequence;
    private long slaSequence;
    private long alertSequence;

    /**
     * Run a read-check-mutate unit atomically with respect to every other writer.
     * Nested inserts and updates join the same unit.
     */
    public <R> R inTransaction(Supplier<R> unit) {
        return write(unit);
    }

    // ------------------------------------------------------------------
    // Clients
    // ------------------------------------------------------------------

    public Client insertClient(Client client) {
        return write(() -> {
            long id = ++clientSequence;
            Client stored = client.toBuilder().clientId(id).build();
            clients.put(id, stored);
            log.debug("Stored client {}", id);
            return stored.toBuilder().build();
        });
    }

    public Optional<Client> findClientById(Long clientId) {
        return read(() -> Optional.ofNullable(clients.get(clientId)).map(c -> c.toBuilder().build()));
    }

    public List<Long> findContractIdsByClientId(Long clientId) {
        return read(() -> snapshot(contractIdsByClient, clientId));
    }

    // ------------------------------------------------------------------
    // Contracts
    // ------------------------------------------------------------------

    public Contract insertContract(Contract contract) {
        return write(() -> {
            long id = ++contractSequence;
            Contract stored = contract.toBuilder().contractId(id).build();
            contracts.put(id, stored);
            contractIdsByClient.computeIfAbsent(stored.getClientId(), k -> new ArrayList<>()).add(id);
            if (hasText(stored.getExternalId())) {
                contractIdsByExternalId.put(stored.getExternalId(), id);
            }
            log.debug("Stored contract {} for client {}", id, stored.getClientId());
            return stored.toBuilder().build();
        });
    }

    public Optional<Contract> findContractById(Long contractId) {
        return read(() -> Optional.ofNullable(contracts.get(contractId)).map(c -> c.toBuilder().build()));
    }

    public Optional<Contract> findContractByExternalId(String externalId) {
        if (!hasText(externalId)) {
            return Optional.empty();
        }
        return read(() -> Optional.ofNullable(contractIdsByExternalId.get(externalId))
                .map(contracts::get)
                .map(c -> c.toBuilder().build()));
    }

    public Optional<Contract> updateContract(Long contractId, Consumer<Contract> mutation) {
        return update(contracts, contractId, mutation, c -> c.toBuilder().build());
    }

    public List<Long> findSlaIdsByContractId(Long contractId) {
        return read(() -> snapshot(slaIdsByContract, contractId));
    }

    // ------------------------------------------------------------------
    // SLAs
    // ------------------------------------------------------------------

    public Sla insertSla(Sla sla) {
        return write(() -> {
            long id = ++slaSequence;
            Sla stored = sla.toBuilder().slaId(id).build();
            slas.put(id, stored);
            slaIdsByContract.computeIfAbsent(stored.getContractId(), k -> new ArrayList<>()).add(id);
            log.debug("Stored SLA {} for contract {}", id, stored.getContractId());
            return stored.toBuilder().build();
        });
    }

    public Optional<Sla> findSlaById(Long slaId) {
        return read(() -> Optional.ofNullable(slas.get(slaId)).map(s -> s.toBuilder().build()));
    }

    public Optional<Sla> updateSla(Long slaId, Consumer<Sla> mutation) {
        return update(slas, slaId, mutation, s -> s.toBuilder().build());
    }

    public long countSlasByStatus(SlaStatus status) {
        return read(() -> slas.values().stream().filter(s -> s.getStatus() == status).count());
    }

    public List<Long> findAlertIdsBySlaId(Long slaId) {
        return read(() -> snapshot(alertIdsBySla, slaId));
    }

    // ------------------------------------------------------------------
    // Alerts
    // ------------------------------------------------------------------

    public Alert insertAlert(Alert alert) {
        return write(() -> {
            long id = ++alertSequence;
            Alert stored = alert.toBuilder().alertId(id).build();
            alerts.put(id, stored);
            alertIdsBySla.computeIfAbsent(stored.getSlaId(), k -> new ArrayList<>()).add(id);
            log.debug("Stored alert {} for SLA {}", id, stored.getSlaId());
            return stored.toBuilder().build();
        });
    }

    public Optional<Alert> findAlertById(Long alertId) {
        return read(() -> Optional.ofNullable(alerts.get(alertId)).map(a -> a.toBuilder().build()));
    }

    public Optional<Alert> updateAlert(Long alertId, Consumer<Alert> mutation) {
        return update(alerts, alertId, mutation, a -> a.toBuilder().build());
    }

    public long countAlertsByStatus(AlertStatus status) {
        return read(() -> alerts.values().stream().filter(a -> a.getStatus() == status).count());
    }

    // ------------------------------------------------------------------

    private <T> Optional<T> update(Map<Long, T> table, Long id, Consumer<T> mutation, Function<T, T> copier) {
        return write(() -> {
            T stored = table.get(id);
            if (stored == null) {
                return Optional.empty();
            }
            mutation.accept(stored);
            return Optional.of(copier.apply(stored));
        });
    }

    private <R> R write(Supplier<R> action) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }

    private <R> R read(Supplier<R> action) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    private static List<Long> snapshot(Map<Long, List<Long>> index, Long parentId) {
        List<Long> children = index.get(parentId);
        return children == null ? List.of() : List.copyOf(children);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
