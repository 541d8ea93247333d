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
 * Append-only credential list of an identity, capped at
 * {@link RegistryLimits#MAX_CREDENTIALS}. Stored credentials are never changed
 * or removed.
 */
public class CredentialVault {

    private final IdentityRegistry identityRegistry;
    private final LifecycleManager lifecycleManager;

    public CredentialVault(IdentityRegistry identityRegistry, LifecycleManager lifecycleManager) {
        this.identityRegistry = Objects.requireNonNull(identityRegistry);
        this.lifecycleManager = Objects.requireNonNull(lifecycleManager);
    }

    public void addCredential(RegistryTransaction tx, LedgerContext context, String credential) {
        Owner caller = context.caller();
        IdentityRecord record = identityRegistry.require(tx, caller);
        lifecycleManager.requireActive(record, caller);
        if (!CredentialFormat.isValid(credential)) {
            throw new RegistryException(RegistryErrorCode.INVALID_CREDENTIAL_FORMAT,
                    "Credential must be 1 to " + RegistryLimits.MAX_CREDENTIAL_LENGTH + " characters");
        }
        if (record.credentials().isFull()) {
            throw new RegistryException(RegistryErrorCode.MAX_CREDENTIALS,
                    "Identity of " + caller + " already holds " + RegistryLimits.MAX_CREDENTIALS + " credentials");
        }

        IdentityRecord updated = record.withCredential(credential, context.height());
        tx.putIdentity(caller, updated);
        tx.emit(RegistryEvent.of(EventType.CREDENTIAL_ADDED, caller, context.height(),
                Map.of("index", String.valueOf(updated.credentials().size() - 1))));
    }

    /**
     * True if the owner's identity exists, is active and holds exactly this
     * credential. Membership only; the statement itself is not verified.
     */
    public boolean verifyCredential(RegistryTransaction tx, Owner owner, String credential) {
        if (credential == null) {
            return false;
        }
        return tx.identity(owner)
                .filter(IdentityRecord::active)
                .map(record -> record.credentials().contains(credential))
                .orElse(false);
    }

    public int getCredentialCount(RegistryTransaction tx, Owner owner) {
        return tx.identity(owner)
                .map(record -> record.credentials().size())
                .orElse(0);
    }
}
