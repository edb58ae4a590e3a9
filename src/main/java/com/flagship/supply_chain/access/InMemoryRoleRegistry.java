package com.flagship.supply_chain.access;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link RoleRegistry}.
 *
 * Role members are kept in one concurrent set per role, verification in a separate
 * concurrent set. The configured admin principal is granted ADMIN at construction.
 */
@Component
@Slf4j
public class InMemoryRoleRegistry implements RoleRegistry {

    private final Map<Role, Set<Principal>> members = new EnumMap<>(Role.class);
    private final Set<Principal> verified = ConcurrentHashMap.newKeySet();

    public InMemoryRoleRegistry(
            @Value("${supply-chain.access.admin-principal}") String adminPrincipal,
            @Value("${supply-chain.access.admin-verified:false}") boolean adminVerified) {
        for (Role role : Role.values()) {
            members.put(role, ConcurrentHashMap.newKeySet());
        }

        Principal admin = Principal.of(adminPrincipal);
        members.get(Role.ADMIN).add(admin);
        if (adminVerified) {
            verified.add(admin);
        }
        log.info("Role registry bootstrapped: admin={}, verified={}", admin, adminVerified);
    }

    @Override
    public boolean hasRole(Principal principal, Role role) {
        return members.get(role).contains(principal);
    }

    @Override
    public boolean isVerified(Principal principal) {
        return verified.contains(principal);
    }

    @Override
    public void markVerified(Principal principal) {
        if (verified.add(principal)) {
            log.debug("Principal verified: {}", principal);
        }
    }

    @Override
    public void grantRole(Principal principal, Role role) {
        if (members.get(role).add(principal)) {
            log.debug("Granted role {} to {}", role, principal);
        }
    }

    @Override
    public void revokeRole(Principal principal, Role role) {
        if (members.get(role).remove(principal)) {
            log.debug("Revoked role {} from {}", role, principal);
        }
    }

    @Override
    public Set<Role> rolesOf(Principal principal) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        members.forEach((role, holders) -> {
            if (holders.contains(principal)) {
                roles.add(role);
            }
        });
        return roles;
    }

    @Override
    public int countMembers(Role role) {
        return members.get(role).size();
    }
}
