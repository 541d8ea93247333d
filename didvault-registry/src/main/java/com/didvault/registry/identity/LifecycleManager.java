package com.didvault.registry.identity;

import com.didvault.registry.LedgerContext;
import com.didvault.registry.Owner;
import com.didvault.registry.RegistryErrorCode;
import com.didvault.registry.RegistryException;
import com.didvault.registry.RegistryLimits;
import com.didvault.registry.event.RegistryEvent;
import com.didvault.registry.event.RegistryEvent.EventType;
import com.didvault.registry.store.RegistryTransaction;

import java.util.Map;
import java.util.Objects;

/**
 * Active / deactivated status of identities.
 *
 * Deactivation is reversible and blocks every mutation except reactivation
 * and revocation.
 */
public class LifecycleManager {

    private final IdentityRegistry identityRegistry;

    public LifecycleManager(IdentityRegistry identityRegistry) {
        this.identityRegistry = Objects.requireNonNull(identityRegistry);
    }

    /**
     * Deactivates the caller's identity.
     *
     * @param reason optional, at most {@link RegistryLimits#MAX_REASON_LENGTH} characters
     */
    public void deactivateDid(RegistryTransaction tx, LedgerContext context, String reason) {
        if (reason != null && reason.length() > RegistryLimits.MAX_REASON_LENGTH) {
            throw new IllegalArgumentException(
                    "Reason exceeds " + RegistryLimits.MAX_REASON_LENGTH + " characters");
        }
        Owner caller = context.caller();
        IdentityRecord record = identityRegistry.require(tx, caller);
        if (!record.active()) {
            throw new RegistryException(RegistryErrorCode.ALREADY_DEACTIVATED,
                    "Identity of " + caller + " is already deactivated");
        }

        tx.putIdentity(caller, record.deactivate(reason, context.height()));
        tx.emit(RegistryEvent.of(EventType.DID_DEACTIVATED, caller, context.height(),
                reason != null ? Map.of("reason", reason) : Map.of()));
    }

    /**
     * Reactivates the caller's identity and clears the deactivation reason.
     */
    public void reactivateDid(RegistryTransaction tx, LedgerContext context) {
        Owner caller = context.caller();
        IdentityRecord record = identityRegistry.require(tx, caller);
        if (record.active()) {
            throw new RegistryException(RegistryErrorCode.ALREADY_DEACTIVATED,
                    "Identity of " + caller + " is already active");
        }

        tx.putIdentity(caller, record.reactivate(context.height()));
        tx.emit(RegistryEvent.of(EventType.DID_REACTIVATED, caller, context.height()));
    }

    public boolean isDidActive(RegistryTransaction tx, Owner owner) {
        return tx.identity(owner).map(IdentityRecord::active).orElse(false);
    }

    public void requireActive(IdentityRecord record, Owner owner) {
        if (!record.active()) {
            throw new RegistryException(RegistryErrorCode.DEACTIVATED,
                    "Identity of " + owner + " is deactivated");
        }
    }
}
