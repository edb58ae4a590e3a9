package com.flagship.supply_chain.ledger;

import com.flagship.supply_chain.access.Principal;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One journal line: a debit or credit of a single holder within a transaction.
 * Entries are never modified after they are written.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    Principal holder;
    BigDecimal amount;
    EntryType entryType;
    String description;
    long sequenceNumber;
    Instant recordedAt;
}
