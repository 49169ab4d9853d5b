package com.flagship.retail_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One line of an account's balance journal.
 *
 * Key invariant: every balance mutation writes exactly one entry, and
 * {@code balanceAfter} of the latest entry equals the account balance.
 * Amount is signed: negative for debits.
 */
@Value
public class BalanceEntry {
    Long id;
    UUID accountId;
    EntryType entryType;
    BigDecimal amount;
    BigDecimal balanceAfter;
    String description;
    String reference;
    Instant createdAt;
}
