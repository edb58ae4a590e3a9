package com.flagship.supply_chain.ledger;

/**
 * The ledger refused to move tokens.
 */
public class LedgerTransferException extends RuntimeException {

    public LedgerTransferException(String message) {
        super(message);
    }
}
