package com.flagship.points_ledger.withdraw;

import lombok.Value;

/**
 * Which rail paid a withdrawal and the rail's transaction id (may be null).
 */
@Value
public class PayoutResult {
    String provider;
    String txId;
}
