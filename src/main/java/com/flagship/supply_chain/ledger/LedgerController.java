package com.flagship.supply_chain.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.supply_chain.access.AccessService;
import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.access.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * REST endpoints over the in-process token ledger.
 *
 * Balances and journal lines are public. Minting is admin only.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final String PRINCIPAL_HEADER = "X-Principal";

    private final InMemoryTokenLedger ledger;
    private final AccessService accessService;

    @GetMapping("/balances/{principal}")
    public ResponseEntity<BalanceResponse> balance(@PathVariable("principal") String principal) {
        Principal holder = Principal.of(principal);
        return ResponseEntity.ok(new BalanceResponse(holder.getAddress(), ledger.balanceOf(holder)));
    }

    @GetMapping("/entries/{principal}")
    public ResponseEntity<List<LedgerEntry>> entries(@PathVariable("principal") String principal) {
        return ResponseEntity.ok(ledger.entriesFor(Principal.of(principal)));
    }

    @PostMapping("/mint")
    public ResponseEntity<MintResponse> mint(
            @Valid @RequestBody MintRequest request,
            @RequestHeader(PRINCIPAL_HEADER) String caller) {
        accessService.requireRole(Principal.of(caller), Role.ADMIN);

        Principal holder = Principal.of(request.getTo());
        UUID transactionId = ledger.mint(holder, request.getAmount());
        log.info("Minted tokens: to={}, amount={}, txId={}", holder, request.getAmount(), transactionId);

        return ResponseEntity.ok(new MintResponse(transactionId, holder.getAddress(), ledger.balanceOf(holder)));
    }

    @Value
    public static class MintRequest {
        @NotBlank(message = "Recipient is required")
        @JsonProperty("to")
        String to;

        @NotNull(message = "Amount is required")
        @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
        @JsonProperty("amount")
        BigDecimal amount;
    }

    @Value
    public static class BalanceResponse {
        @JsonProperty("principal")
        String principal;

        @JsonProperty("balance")
        BigDecimal balance;
    }

    @Value
    public static class MintResponse {
        @JsonProperty("transaction_id")
        UUID transactionId;

        @JsonProperty("to")
        String to;

        @JsonProperty("balance")
        BigDecimal balance;
    }
}
