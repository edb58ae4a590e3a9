package com.flagship.supply_chain.access;

import java.util.Set;

/**
 * Role membership and verification lookups.
 *
 * Callers must not cache answers across transitions; every query reflects the registry
 * at the time it is made. Admin gating of the mutating methods is the caller's job.
 */
public interface RoleRegistry {

    boolean hasRole(Principal principal, Role role);

    boolean isVerified(Principal principal);

    void markVerified(Principal principal);

    void grantRole(Principal principal, Role role);

    void revokeRole(Principal principal, Role role);

    /**
     * Snapshot of the roles currently held by a principal.
     */
    Set<Role> rolesOf(Principal principal);

    /**
     * Number of principals currently holding a role.
     */
    int countMembers(Role role);
}
