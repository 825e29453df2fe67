package com.flagship.points_ledger.withdraw;

import lombok.Getter;

@Getter
public class WithdrawRequestNotFoundException extends RuntimeException {

    private final long withdrawId;

    public WithdrawRequestNotFoundException(long withdrawId) {
        super("Withdraw request not found: " + withdrawId);
        this.withdrawId = withdrawId;
    }
}
