package com.didvault.registry.identity;

import com.didvault.registry.LedgerContext;
import com.didvault.registry.OrphanedStatePolicy;
import com.didvault.registry.Owner;
import com.didvault.registry.RegistryErrorCode;
import com.didvault.registry.RegistryException;
import com.didvault.registry.RegistrySettings;
import com.didvault.registry.event.RegistryEvent;
import com.didvault.registry.event.RegistryEvent.EventType;
import com.didvault.registry.store.RegistryTransaction;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owner to identity mapping.
 *
 * An owner holds at most one identity. Reads are public; writes act on the
 * caller's own record only.
 */
public class IdentityRegistry {

    private final RegistrySettings settings;

    public IdentityRegistry(RegistrySettings settings) {
        this.settings = Objects.requireNonNull(settings);
    }

    /**
     * Registers a DID for the caller.
     */
    public void createDid(RegistryTransaction tx, LedgerContext context, String did) {
        Owner caller = context.caller();
        if (tx.identity(caller).isPresent()) {
            throw new RegistryException(RegistryErrorCode.ALREADY_EXISTS,
                    "Identity already registered for " + caller);
        }
        if (!DidFormat.isValid(did)) {
            throw new RegistryException(RegistryErrorCode.INVALID_DID_FORMAT,
                    "DID must start with the method prefix and be at most 100 characters");
        }

        tx.putIdentity(caller, IdentityRecord.create(did, context.height()));
        tx.emit(RegistryEvent.of(EventType.DID_CREATED, caller, context.height(), Map.of("did", did)));
    }

    public Optional<IdentityRecord> getDid(RegistryTransaction tx, Owner owner) {
        return tx.identity(owner);
    }

    /**
     * Permanently removes the caller's identity. Pending transfer and history
     * entries of the caller follow the configured {@link OrphanedStatePolicy}.
     */
    public void revokeDid(RegistryTransaction tx, LedgerContext context) {
        Owner caller = context.caller();
        IdentityRecord record = require(tx, caller);

        tx.deleteIdentity(caller);
        tx.emit(RegistryEvent.of(EventType.DID_REVOKED, caller, context.height(), Map.of("did", record.did())));

        if (settings.orphanedStatePolicy() == OrphanedStatePolicy.CASCADE) {
            boolean hadPendingTransfer = tx.pendingTransfer(caller).isPresent();
            boolean hadHistory = !tx.transferHistory(caller).isEmpty();
            tx.deletePendingTransfer(caller);
            tx.deleteTransferHistory(caller);
            if (hadPendingTransfer || hadHistory) {
                tx.emit(RegistryEvent.of(EventType.ORPHANED_STATE_PURGED, caller, context.height(), Map.of(
                        "pendingTransfer", String.valueOf(hadPendingTransfer),
                        "history", String.valueOf(hadHistory))));
            }
        }
    }

    /**
     * Record of the owner, or {@link RegistryErrorCode#NOT_FOUND}.
     */
    public IdentityRecord require(RegistryTransaction tx, Owner owner) {
        return tx.identity(owner)
                .orElseThrow(() -> new RegistryException(RegistryErrorCode.NOT_FOUND,
                        "No identity registered for " + owner));
    }
}
