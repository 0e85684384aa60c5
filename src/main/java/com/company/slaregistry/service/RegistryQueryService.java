package com.company.slaregistry.service;

import com.company.slaregistry.domain.Alert;
import com.company.slaregistry.domain.Client;
import com.company.slaregistry.domain.Contract;
import com.company.slaregistry.domain.Sla;
import com.company.slaregistry.exception.EntityNotFoundException;
import com.company.slaregistry.repository.EntityStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class RegistryQueryService {

    private final EntityStore store;

    public Client getClient(Long clientId) {
        return store.findClientById(clientId)
                .orElseThrow(() -> new EntityNotFoundException("Client", clientId));
    }

    public Contract getContract(Long contractId) {
        return store.findContractById(contractId)
                .orElseThrow(() -> new EntityNotFoundException("Contract", contractId));
    }

    public Contract getContractByExternalId(String externalId) {
        return store.findContractByExternalId(externalId)
                .orElseThrow(() -> new EntityNotFoundException("Contract with external id", externalId));
    }

    public Sla getSla(Long slaId) {
        return store.findSlaById(slaId)
                .orElseThrow(() -> new EntityNotFoundException("SLA", slaId));
    }

    public Alert getAlert(Long alertId) {
        return store.findAlertById(alertId)
                .orElseThrow(() -> new EntityNotFoundException("Alert", alertId));
    }

    /**
     * Contract ids of a client, in creation order
     */
    public List<Long> getClientContracts(Long clientId) {
        getClient(clientId);
        return store.findContractIdsByClientId(clientId);
    }

    /**
     * SLA ids of a contract, in creation order
     */
    public List<Long> getContractSlas(Long contractId) {
        getContract(contractId);
        return store.findSlaIdsByContractId(contractId);
    }

    /**
     * Alert ids raised for an SLA, in creation order
     */
    public List<Long> getSlaAlerts(Long slaId) {
        getSla(slaId);
        return store.findAlertIdsBySlaId(slaId);
    }
}
