package com.company.slaregistry.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Resolve the identity of the calling service or operator from the security context
 */
@Component
@Slf4j
public class CallerContext {

    static final String ANONYMOUS = "anonymous";

    /**
     * Caller id from the JWT subject claim, falling back to the authentication name
     */
    public String getCurrentCallerId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return ANONYMOUS;
        }

        if (authentication.getPrincipal() instanceof Jwt jwt) {
            String subject = jwt.getSubject();
            if (subject != null) {
                return subject;
            }
            log.warn("JWT without sub claim, using authentication name");
        }

        return authentication.getName() != null ? authentication.getName() : ANONYMOUS;
    }

    /**
     * Display name for audit columns: preferred_username or email claim when present
     */
    public String getCurrentCallerDisplayName() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.getPrincipal() instanceof Jwt jwt) {
            String name = jwt.getClaimAsString("preferred_username");
            if (name == null) {
                name = jwt.getClaimAsString("email");
            }
            if (name != null) {
                return name;
            }
        }

        return getCurrentCallerId();
    }
}
