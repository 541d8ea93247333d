package com.didvault.registry.transfer;

import com.didvault.registry.Owner;
import com.didvault.registry.RegistryLimits;

import java.util.Objects;

/**
 * Ownership transfer offered by the current owner and awaiting acceptance.
 */
public record PendingTransfer(Owner newOwner, long initiatedAt, long expiresAt) {

    public PendingTransfer {
        Objects.requireNonNull(newOwner, "New owner cannot be null");
        if (expiresAt < initiatedAt) {
            throw new IllegalArgumentException("Transfer cannot expire before it is initiated");
        }
    }

    public static PendingTransfer open(Owner newOwner, long height) {
        return new PendingTransfer(newOwner, height, height + RegistryLimits.TRANSFER_WINDOW);
    }

    /**
     * Expiry is evaluated lazily; an expired transfer is still stored until cancelled.
     */
    public boolean isExpiredAt(long height) {
        return height > expiresAt;
    }
}
