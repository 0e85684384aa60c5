package com.company.slaregistry.exception;

import com.company.slaregistry.security.Capability;

public class CapabilityDeniedException extends SlaRegistryException {
    public CapabilityDeniedException(String caller, Capability capability) {
        super(ErrorKind.CAPABILITY_DENIED, "Caller " + caller + " lacks capability " + capability);
    }
}
