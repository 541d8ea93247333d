package com.didvault.registry;

import java.util.Objects;

/**
 * Ledger-authenticated principal. Primary key of every registry store.
 *
 * The registry never establishes an owner itself; it receives one from the
 * ledger context on every call.
 */
public record Owner(String principal) {

    public Owner {
        Objects.requireNonNull(principal, "Principal cannot be null");
        if (principal.isBlank()) {
            throw new IllegalArgumentException("Principal cannot be blank");
        }
    }

    public static Owner of(String principal) {
        return new Owner(principal);
    }

    @Override
    public String toString() {
        return principal;
    }
}
