package com.flagship.points_ledger.ledger;

import java.util.Arrays;

/**
 * Kinds of domain objects a ledger entry can point back to.
 * Stored in {@code ledger_entries.ref_type} as {@link #getCode()}.
 */
public enum LedgerRefType {
    MISSION("mission"),
    WITHDRAW_REQUEST("withdraw_request"),
    PURCHASE("purchase"),
    REFERRAL("referral"),
    TASK("task"),
    AD_VIEW("ad_view"),
    /**
     * A stored code this build does not know, e.g. written by newer code.
     * Only produced when reading; never written.
     */
    UNKNOWN("unknown");

    private final String code;

    LedgerRefType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static LedgerRefType fromCode(String code) {
        LedgerRefType type = fromStoredCode(code);
        if (type == UNKNOWN) {
            throw new IllegalArgumentException("Unknown ledger reference type: " + code);
        }
        return type;
    }

    /**
     * Like {@link #fromCode} but maps unrecognized codes to {@link #UNKNOWN},
     * for reading entries that may predate or postdate this build.
     */
    public static LedgerRefType fromStoredCode(String code) {
        return Arrays.stream(values())
            .filter(type -> type.code.equals(code))
            .filter(type -> type != UNKNOWN)
            .findFirst()
            .orElse(UNKNOWN);
    }
}
