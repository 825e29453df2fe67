package com.flagship.points_ledger.ledger;

import lombok.Value;

/**
 * Outcome of comparing an account's cached balance with its ledger.
 */
@Value
public class ReconciliationResult {
    long accountId;
    long previousBalance;
    long ledgerBalance;

    public boolean isCorrected() {
        return previousBalance != ledgerBalance;
    }
}
