package com.flagship.supply_chain.access;

import com.flagship.supply_chain.product.exception.FailureReason;
import com.flagship.supply_chain.product.exception.ProductLifecycleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Access guards and admin operations over an in-memory registry.
 */
class AccessServiceTest {

    private static final Principal ADMIN = Principal.of("admin");
    private static final Principal ALICE = Principal.of("0xAlice");

    private RoleRegistry registry;
    private AccessService accessService;

    @BeforeEach
    void setUp() {
        registry = new InMemoryRoleRegistry("admin", false);
        accessService = new AccessService(registry);
    }

    @Test
    @DisplayName("Principals are normalized to lower case")
    void testPrincipalNormalization() {
        assertEquals(Principal.of("0xalice"), ALICE);
        assertEquals("0xalice", Principal.of("  0xALICE ").getAddress());
        assertThrows(IllegalArgumentException.class, () -> Principal.of(" "));
        assertThrows(IllegalArgumentException.class, () -> Principal.of(null));
    }

    @Test
    @DisplayName("Configured admin holds ADMIN but is not verified")
    void testAdminBootstrap() {
        assertTrue(registry.hasRole(ADMIN, Role.ADMIN));
        assertFalse(registry.isVerified(ADMIN));
        assertEquals(1, registry.countMembers(Role.ADMIN));

        RoleRegistry verifiedAdmin = new InMemoryRoleRegistry("Root", true);
        assertTrue(verifiedAdmin.isVerified(Principal.of("root")));
    }

    @Test
    @DisplayName("Missing role is UNAUTHORIZED even when verified")
    void testRequireRole() {
        accessService.verifyUser(ADMIN, ALICE);

        ProductLifecycleException e = assertThrows(ProductLifecycleException.class,
            () -> accessService.requireVerifiedRole(ALICE, Role.SHIPPER));
        assertEquals(FailureReason.UNAUTHORIZED, e.getReason());
    }

    @Test
    @DisplayName("Role without verification is NOT_VERIFIED")
    void testRequireVerifiedRole() {
        accessService.grantRole(ADMIN, ALICE, Role.SHIPPER);

        ProductLifecycleException e = assertThrows(ProductLifecycleException.class,
            () -> accessService.requireVerifiedRole(ALICE, Role.SHIPPER));
        assertEquals(FailureReason.NOT_VERIFIED, e.getReason());

        accessService.verifyUser(ADMIN, ALICE);
        assertDoesNotThrow(() -> accessService.requireVerifiedRole(ALICE, Role.SHIPPER));
    }

    @Test
    @DisplayName("Admin operations require ADMIN")
    void testAdminOperationsGated() {
        accessService.grantRole(ADMIN, ALICE, Role.PRODUCER);

        assertEquals(FailureReason.UNAUTHORIZED, assertThrows(ProductLifecycleException.class,
            () -> accessService.verifyUser(ALICE, ALICE)).getReason());
        assertEquals(FailureReason.UNAUTHORIZED, assertThrows(ProductLifecycleException.class,
            () -> accessService.grantRole(ALICE, ALICE, Role.ADMIN)).getReason());
        assertEquals(FailureReason.UNAUTHORIZED, assertThrows(ProductLifecycleException.class,
            () -> accessService.revokeRole(ALICE, ALICE, Role.PRODUCER)).getReason());

        assertFalse(registry.isVerified(ALICE));
        assertFalse(registry.hasRole(ALICE, Role.ADMIN));
    }

    @Test
    @DisplayName("Verifying twice is a no-op")
    void testVerifyIdempotent() {
        accessService.verifyUser(ADMIN, ALICE);
        accessService.verifyUser(ADMIN, ALICE);
        assertTrue(registry.isVerified(ALICE));
    }

    @Test
    @DisplayName("Last admin cannot be revoked, a second admin can")
    void testLastAdminGuard() {
        ProductLifecycleException e = assertThrows(ProductLifecycleException.class,
            () -> accessService.revokeRole(ADMIN, ADMIN, Role.ADMIN));
        assertEquals(FailureReason.INVALID_STATE, e.getReason());
        assertTrue(registry.hasRole(ADMIN, Role.ADMIN));

        accessService.grantRole(ADMIN, ALICE, Role.ADMIN);
        accessService.revokeRole(ALICE, ADMIN, Role.ADMIN);
        assertFalse(registry.hasRole(ADMIN, Role.ADMIN));
        assertEquals(1, registry.countMembers(Role.ADMIN));
    }

    @Test
    @DisplayName("Describe reports roles and verification")
    void testDescribe() {
        accessService.grantRole(ADMIN, ALICE, Role.BUYER);
        accessService.grantRole(ADMIN, ALICE, Role.SHIPPER);
        accessService.verifyUser(ADMIN, ALICE);

        AccessService.PrincipalAccess access = accessService.describe(ALICE);
        assertEquals("0xalice", access.getPrincipal());
        assertEquals(EnumSet.of(Role.BUYER, Role.SHIPPER), access.getRoles());
        assertTrue(access.isVerified());

        AccessService.PrincipalAccess unknown = accessService.describe(Principal.of("0xnobody"));
        assertTrue(unknown.getRoles().isEmpty());
        assertFalse(unknown.isVerified());
    }
}
