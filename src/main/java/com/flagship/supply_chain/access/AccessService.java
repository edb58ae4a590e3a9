package com.flagship.supply_chain.access;

import com.flagship.supply_chain.product.exception.FailureReason;
import com.flagship.supply_chain.product.exception.ProductLifecycleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Role and verification guards, plus the admin operations that change them.
 *
 * Guard order for custody actions is fixed:
 * 1. UNAUTHORIZED if the caller does not hold the role
 * 2. NOT_VERIFIED if the caller holds the role but is not verified
 *
 * The registry is queried on every call; nothing is cached here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessService {

    private final RoleRegistry roleRegistry;

    /**
     * Requires the caller to hold a role, regardless of verification.
     *
     * @throws ProductLifecycleException with UNAUTHORIZED
     */
    public void requireRole(Principal caller, Role role) {
        if (!roleRegistry.hasRole(caller, role)) {
            throw ProductLifecycleException.unauthorized(null,
                String.format("Principal %s does not hold role %s", caller, role));
        }
    }

    /**
     * Requires the caller to hold a role and to be verified.
     *
     * @throws ProductLifecycleException with UNAUTHORIZED, then NOT_VERIFIED
     */
    public void requireVerifiedRole(Principal caller, Role role) {
        requireRole(caller, role);
        if (!roleRegistry.isVerified(caller)) {
            throw new ProductLifecycleException(FailureReason.NOT_VERIFIED, null,
                String.format("Principal %s holds role %s but is not verified", caller, role));
        }
    }

    /**
     * Marks a principal verified. Admin only; verifying twice is a no-op.
     */
    public void verifyUser(Principal caller, Principal principal) {
        requireRole(caller, Role.ADMIN);
        roleRegistry.markVerified(principal);
        log.info("Principal verified: principal={}, by={}", principal, caller);
    }

    /**
     * Grants a role. Admin only.
     */
    public void grantRole(Principal caller, Principal principal, Role role) {
        requireRole(caller, Role.ADMIN);
        roleRegistry.grantRole(principal, role);
        log.info("Role granted: principal={}, role={}, by={}", principal, role, caller);
    }

    /**
     * Revokes a role. Admin only. The last remaining admin cannot be revoked.
     */
    public void revokeRole(Principal caller, Principal principal, Role role) {
        requireRole(caller, Role.ADMIN);
        if (role == Role.ADMIN
                && roleRegistry.hasRole(principal, Role.ADMIN)
                && roleRegistry.countMembers(Role.ADMIN) == 1) {
            throw new ProductLifecycleException(FailureReason.INVALID_STATE, null,
                "Cannot revoke ADMIN from the last admin " + principal);
        }
        roleRegistry.revokeRole(principal, role);
        log.info("Role revoked: principal={}, role={}, by={}", principal, role, caller);
    }

    public PrincipalAccess describe(Principal principal) {
        Set<Role> roles = roleRegistry.rolesOf(principal);
        return new PrincipalAccess(principal.getAddress(), roles, roleRegistry.isVerified(principal));
    }

    /**
     * Read model of one principal's grants.
     */
    @lombok.Value
    public static class PrincipalAccess {
        String principal;
        Set<Role> roles;
        boolean verified;
    }
}
