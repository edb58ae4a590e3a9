package com.flagship.supply_chain.ledger;

import com.flagship.supply_chain.access.Principal;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * The holder's balance was below the amount at the moment of transfer.
 */
@Getter
public class InsufficientBalanceException extends LedgerTransferException {

    private final Principal holder;
    private final BigDecimal balance;
    private final BigDecimal amount;

    public InsufficientBalanceException(Principal holder, BigDecimal balance, BigDecimal amount) {
        super(String.format("Insufficient balance for %s: balance=%s, amount=%s", holder, balance, amount));
        this.holder = holder;
        this.balance = balance;
        this.amount = amount;
    }
}
