package com.flagship.points_ledger.ledger;

import lombok.Value;

import java.util.Objects;

/**
 * Weak back-reference from a ledger entry to the object that caused it.
 * Lookup only: there is no ownership and no cascade.
 */
@Value
public class LedgerReference {
    LedgerRefType type;
    /** The {@code ref_type} code as stored; differs from {@code type.getCode()} only for UNKNOWN. */
    String code;
    long id;

    private LedgerReference(LedgerRefType type, String code, long id) {
        this.type = type;
        this.code = code;
        this.id = id;
    }

    public static LedgerReference of(LedgerRefType type, long id) {
        Objects.requireNonNull(type, "Reference type is required");
        if (type == LedgerRefType.UNKNOWN) {
            throw new IllegalArgumentException("UNKNOWN is not a writable reference type");
        }
        return new LedgerReference(type, type.getCode(), id);
    }

    public static LedgerReference withdrawRequest(long withdrawRequestId) {
        return of(LedgerRefType.WITHDRAW_REQUEST, withdrawRequestId);
    }

    static LedgerReference fromStored(String code, long id) {
        return new LedgerReference(LedgerRefType.fromStoredCode(code), code, id);
    }

    /**
     * Analytics category used when a balance change does not name one.
     */
    public String defaultEventType() {
        return switch (type) {
            case MISSION, TASK -> "mission";
            case WITHDRAW_REQUEST -> "withdraw";
            case PURCHASE -> "purchase";
            case REFERRAL -> "referral";
            case AD_VIEW -> "ad";
            case UNKNOWN -> code;
        };
    }
}
