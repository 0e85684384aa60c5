package com.company.slaregistry.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Grants capabilities from the roles of the authentication bound to the current thread.
 * ROLE_ADMIN holds every capability.
 */
@Component
@Slf4j
public class RoleCapabilityCheck implements CapabilityCheck {

    static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

    @Override
    public boolean isGranted(String caller, Capability capability) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            log.debug("No authenticated caller for capability {}", capability);
            return false;
        }

        return authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(authority -> ADMIN_AUTHORITY.equals(authority)
                        || capability.getAuthority().equals(authority));
    }
}
