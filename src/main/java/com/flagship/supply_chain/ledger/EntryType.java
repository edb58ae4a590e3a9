package com.flagship.supply_chain.ledger;

/**
 * Side of a journal line. A holder's balance is credits minus debits.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
