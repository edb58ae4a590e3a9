package com.flagship.supply_chain.access;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for role and verification administration.
 *
 * The acting principal is taken from the X-Principal header.
 */
@RestController
@RequestMapping("/api/access")
@RequiredArgsConstructor
public class AccessController {

    private static final String PRINCIPAL_HEADER = "X-Principal";

    private final AccessService accessService;

    @PostMapping("/verifications/{principal}")
    public ResponseEntity<AccessService.PrincipalAccess> verify(
            @PathVariable("principal") String principal,
            @RequestHeader(PRINCIPAL_HEADER) String caller) {
        Principal target = Principal.of(principal);
        accessService.verifyUser(Principal.of(caller), target);
        return ResponseEntity.ok(accessService.describe(target));
    }

    @PostMapping("/roles/{principal}/{role}")
    public ResponseEntity<AccessService.PrincipalAccess> grant(
            @PathVariable("principal") String principal,
            @PathVariable("role") Role role,
            @RequestHeader(PRINCIPAL_HEADER) String caller) {
        Principal target = Principal.of(principal);
        accessService.grantRole(Principal.of(caller), target, role);
        return ResponseEntity.ok(accessService.describe(target));
    }

    @DeleteMapping("/roles/{principal}/{role}")
    public ResponseEntity<AccessService.PrincipalAccess> revoke(
            @PathVariable("principal") String principal,
            @PathVariable("role") Role role,
            @RequestHeader(PRINCIPAL_HEADER) String caller) {
        Principal target = Principal.of(principal);
        accessService.revokeRole(Principal.of(caller), target, role);
        return ResponseEntity.ok(accessService.describe(target));
    }

    @GetMapping("/principals/{principal}")
    public ResponseEntity<AccessService.PrincipalAccess> describe(@PathVariable("principal") String principal) {
        return ResponseEntity.ok(accessService.describe(Principal.of(principal)));
    }
}
