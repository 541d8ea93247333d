package com.didvault.registry.identity;

import com.didvault.registry.RegistryLimits;
import com.didvault.registry.store.BoundedSequence;

import java.util.Objects;
import java.util.Optional;

/**
 * Identity held by exactly one owner.
 *
 * The DID and creation height never change. Every other mutation produces a
 * copy with {@code updatedAt} set to the height of the mutation.
 */
public record IdentityRecord(
        String did,
        BoundedSequence<String> credentials,
        long createdAt,
        long updatedAt,
        boolean active,
        String revocationReason
) {
    public IdentityRecord {
        Objects.requireNonNull(did, "DID cannot be null");
        Objects.requireNonNull(credentials, "Credentials cannot be null");
        if (credentials.capacity() != RegistryLimits.MAX_CREDENTIALS) {
            throw new IllegalArgumentException("Credential capacity must be " + RegistryLimits.MAX_CREDENTIALS);
        }
        if (updatedAt < createdAt) {
            throw new IllegalArgumentException("updatedAt cannot precede createdAt");
        }
        if (active && revocationReason != null) {
            throw new IllegalArgumentException("Revocation reason is only kept while deactivated");
        }
    }

    /**
     * New active identity with no credentials.
     */
    public static IdentityRecord create(String did, long height) {
        return new IdentityRecord(
                did,
                BoundedSequence.empty(RegistryLimits.MAX_CREDENTIALS),
                height,
                height,
                true,
                null);
    }

    public IdentityRecord withCredential(String credential, long height) {
        return new IdentityRecord(did, credentials.append(credential), createdAt, height, active, revocationReason);
    }

    public IdentityRecord deactivate(String reason, long height) {
        return new IdentityRecord(did, credentials, createdAt, height, false, reason);
    }

    public IdentityRecord reactivate(long height) {
        return new IdentityRecord(did, credentials, createdAt, height, true, null);
    }

    /**
     * Same record as seen by a new owner after a transfer.
     */
    public IdentityRecord transferredAt(long height) {
        return new IdentityRecord(did, credentials, createdAt, height, active, revocationReason);
    }

    public Optional<String> reason() {
        return Optional.ofNullable(revocationReason);
    }
}
