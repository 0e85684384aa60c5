package com.company.slaregistry.security;

/**
 * Capability classes a caller must hold to invoke the mutating operations.
 */
public enum Capability {
    REGISTRATION("ROLE_CONTRACT_MS"),   // register client, create contract, add SLA, report metric
    NOVELTY("ROLE_NOVELTIES_MS"),       // pause, resume, retarget, reparametrize SLA
    OPERATIONS("ROLE_OPS");             // acknowledge, resolve alert

    private final String authority;

    Capability(String authority) {
        this.authority = authority;
    }

    public String getAuthority() {
        return authority;
    }
}
