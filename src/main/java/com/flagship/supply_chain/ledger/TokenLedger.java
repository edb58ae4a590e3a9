package com.flagship.supply_chain.ledger;

import com.flagship.supply_chain.access.Principal;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Fungible token balances used to settle product payments.
 *
 * Each call is bounded and synchronous: it either completes or fails immediately.
 */
public interface TokenLedger {

    BigDecimal balanceOf(Principal holder);

    /**
     * Moves {@code amount} from one holder to another atomically.
     *
     * @return id of the ledger transaction
     * @throws InsufficientBalanceException if {@code from} holds less than {@code amount}
     * @throws LedgerTransferException if the ledger refuses the transfer for any other reason
     */
    UUID transfer(Principal from, Principal to, BigDecimal amount);
}
