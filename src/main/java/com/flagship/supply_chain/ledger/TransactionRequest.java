package com.flagship.supply_chain.ledger;

import com.flagship.supply_chain.access.Principal;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * A set of journal lines to post together.
 *
 * Invariant: sum of debits equals sum of credits.
 */
@Value
public class TransactionRequest {
    String description;
    List<DebitCredit> debits;
    List<DebitCredit> credits;

    /**
     * Single-debit, single-credit movement of tokens between two holders.
     */
    public static TransactionRequest transfer(Principal from, Principal to, BigDecimal amount, String description) {
        return new TransactionRequest(
            description,
            List.of(DebitCredit.of(from, amount, description + ": debit")),
            List.of(DebitCredit.of(to, amount, description + ": credit"))
        );
    }

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }

    public BigDecimal getDebitTotal() {
        return total(debits);
    }

    public BigDecimal getCreditTotal() {
        return total(credits);
    }

    private static BigDecimal total(List<DebitCredit> lines) {
        return lines.stream()
            .map(DebitCredit::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * One side of a movement: a holder and a strictly positive amount.
     */
    @Value
    public static class DebitCredit {
        Principal holder;
        BigDecimal amount;
        String description;

        private DebitCredit(Principal holder, BigDecimal amount, String description) {
            this.holder = Objects.requireNonNull(holder);
            this.amount = Objects.requireNonNull(amount);
            if (amount.compareTo(BigDecimal.ZERO) <= 0) {
                throw new IllegalArgumentException("Amount must be positive");
            }
            this.description = description;
        }

        public static DebitCredit of(Principal holder, BigDecimal amount, String description) {
            return new DebitCredit(holder, amount, description);
        }
    }
}
