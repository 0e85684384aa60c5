package com.company.slaregistry.security;

import com.company.slaregistry.exception.CapabilityDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entry check for every mutating registry operation.
 * Runs before any precondition so a denied caller learns nothing about entity state.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CapabilityGuard {

    private final CapabilityCheck capabilityCheck;
    private final CallerContext callerContext;

    /**
     * @return the caller id the capability was granted to
     */
    public String require(Capability capability) {
        String caller = callerContext.getCurrentCallerId();

        if (!capabilityCheck.isGranted(caller, capability)) {
            log.warn("Caller {} denied capability {}", caller, capability);
            throw new CapabilityDeniedException(caller, capability);
        }

        return caller;
    }
}
