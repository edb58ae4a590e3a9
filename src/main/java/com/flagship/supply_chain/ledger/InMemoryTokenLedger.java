package com.flagship.supply_chain.ledger;

import com.flagship.supply_chain.access.Principal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Process-local double-entry {@link TokenLedger}.
 *
 * Invariants:
 * 1. Every posted transaction is balanced (debits equal credits)
 * 2. Journal entries are append-only
 * 3. A holder's balance is the sum of its credits minus the sum of its debits
 * 4. No holder other than the treasury goes negative
 *
 * New tokens enter circulation by {@link #mint}, which debits the treasury account.
 * All state is guarded by the ledger's monitor, so a transfer is atomic.
 */
@Component
@Slf4j
public class InMemoryTokenLedger implements TokenLedger {

    public static final Principal TREASURY = Principal.of("treasury");

    private final List<LedgerEntry> journal = new ArrayList<>();
    private final Map<Principal, BigDecimal> balances = new HashMap<>();
    private final Set<Principal> frozen = new HashSet<>();
    private long nextSequence = 1;

    @Override
    public synchronized BigDecimal balanceOf(Principal holder) {
        return balances.getOrDefault(holder, BigDecimal.ZERO);
    }

    @Override
    public synchronized UUID transfer(Principal from, Principal to, BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Transfer amount must be non-negative");
        }
        if (frozen.contains(from)) {
            throw new LedgerTransferException("Account " + from + " is frozen");
        }
        BigDecimal balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(from, balance, amount);
        }
        if (amount.signum() == 0) {
            return UUID.randomUUID();
        }
        return post(TransactionRequest.transfer(from, to, amount,
            String.format("Transfer %s -> %s", from, to)));
    }

    /**
     * Issues new tokens to a holder, balanced against the treasury.
     *
     * @return id of the ledger transaction
     */
    public synchronized UUID mint(Principal to, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Mint amount must be positive");
        }
        return post(TransactionRequest.transfer(TREASURY, to, amount, "Mint to " + to));
    }

    /**
     * Blocks outgoing transfers from a holder. Incoming transfers still succeed.
     */
    public synchronized void freeze(Principal holder) {
        frozen.add(holder);
        log.info("Ledger account frozen: {}", holder);
    }

    public synchronized void unfreeze(Principal holder) {
        frozen.remove(holder);
        log.info("Ledger account unfrozen: {}", holder);
    }

    public synchronized List<LedgerEntry> entriesFor(Principal holder) {
        return journal.stream()
            .filter(entry -> entry.getHolder().equals(holder))
            .toList();
    }

    private UUID post(TransactionRequest request) {
        if (!request.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Transaction is not balanced: debits=%s, credits=%s",
                    request.getDebitTotal(), request.getCreditTotal()));
        }

        UUID transactionId = UUID.randomUUID();
        Instant now = Instant.now();

        for (TransactionRequest.DebitCredit debit : request.getDebits()) {
            append(transactionId, debit, EntryType.DEBIT, now);
            balances.merge(debit.getHolder(), debit.getAmount().negate(), BigDecimal::add);
        }
        for (TransactionRequest.DebitCredit credit : request.getCredits()) {
            append(transactionId, credit, EntryType.CREDIT, now);
            balances.merge(credit.getHolder(), credit.getAmount(), BigDecimal::add);
        }

        log.debug("Posted ledger transaction: txId={}, description={}, amount={}",
            transactionId, request.getDescription(), request.getDebitTotal());
        return transactionId;
    }

    private void append(UUID transactionId, TransactionRequest.DebitCredit line, EntryType type, Instant now) {
        journal.add(new LedgerEntry(
            UUID.randomUUID(),
            transactionId,
            line.getHolder(),
            line.getAmount(),
            type,
            line.getDescription(),
            nextSequence++,
            now
        ));
    }
}
