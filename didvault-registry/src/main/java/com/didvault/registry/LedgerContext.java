package com.didvault.registry;

import java.util.Objects;

/**
 * Per-operation primitives supplied by the ledger: the authenticated caller
 * and the current logical height.
 */
public record LedgerContext(Owner caller, long height) {

    public LedgerContext {
        Objects.requireNonNull(caller, "Caller cannot be null");
        if (height < 0) {
            throw new IllegalArgumentException("Height cannot be negative: " + height);
        }
    }

    public static LedgerContext of(Owner caller, long height) {
        return new LedgerContext(caller, height);
    }
}
