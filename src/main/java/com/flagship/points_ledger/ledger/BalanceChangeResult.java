package com.flagship.points_ledger.ledger;

import lombok.Value;

/**
 * The account as it stands after a change, and the ledger entry recording it.
 */
@Value
public class BalanceChangeResult {
    Account account;
    long ledgerEntryId;
}
