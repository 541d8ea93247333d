package com.didvault.registry.transfer;

import com.didvault.registry.Owner;

import java.util.Objects;

/**
 * Completed transfer, recorded under the recipient.
 */
public record TransferHistoryEntry(Owner from, Owner to, long timestamp) {

    public TransferHistoryEntry {
        Objects.requireNonNull(from, "From cannot be null");
        Objects.requireNonNull(to, "To cannot be null");
    }
}
