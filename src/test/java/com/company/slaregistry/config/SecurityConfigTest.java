package com.company.slaregistry.config;

import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SecurityConfigTest {

    final SecurityConfig securityConfig = new SecurityConfig();

    @Test
    void rolesClaimBecomesRoleAuthorities() {
        Jwt jwt = token(List.of("CONTRACT_MS", "ops"));

        Set<String> authorities = SecurityConfig.roleAuthorities(jwt).stream()
                .map(GrantedAuthority::getAuthority)
                .collect(Collectors.toSet());

        assertEquals(Set.of("ROLE_CONTRACT_MS", "ROLE_OPS"), authorities);
    }

    @Test
    void missingRolesClaimGrantsNothing() {
        assertTrue(SecurityConfig.roleAuthorities(token(null)).isEmpty());
        assertTrue(SecurityConfig.roleAuthorities(token(List.of())).isEmpty());
    }

    @Test
    void scopesAreNotMapped() {
        Jwt jwt = Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("contract-ms")
                .claim("scope", "registry.write")
                .build();

        assertTrue(SecurityConfig.roleAuthorities(jwt).isEmpty());
    }

    @Test
    void converterUsesSubjectAsPrincipalName() {
        AbstractAuthenticationToken authentication =
                securityConfig.jwtAuthenticationConverter().convert(token(List.of("NOVELTIES_MS")));

        assertNotNull(authentication);
        assertEquals("svc-42", authentication.getName());
        assertEquals(1, authentication.getAuthorities().size());
    }

    private static Jwt token(List<String> roles) {
        Jwt.Builder builder = Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("svc-42");
        if (roles != null) {
            builder.claim(SecurityConfig.ROLES_CLAIM, roles);
        }
        return builder.build();
    }
}
