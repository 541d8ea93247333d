package com.didvault.registry;

import com.didvault.registry.event.RegistryEvent;
import com.didvault.registry.event.RegistryEventListener;
import com.didvault.registry.identity.CredentialVault;
import com.didvault.registry.identity.IdentityRecord;
import com.didvault.registry.identity.IdentityRegistry;
import com.didvault.registry.identity.LifecycleManager;
import com.didvault.registry.store.RegistryStore;
import com.didvault.registry.store.RegistryTransaction;
import com.didvault.registry.transfer.PendingTransfer;
import com.didvault.registry.transfer.TransferCoordinator;
import com.didvault.registry.transfer.TransferHistoryEntry;
import com.didvault.registry.transfer.TransferHistoryLog;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Decentralized identity registry.
 *
 * Key features:
 * - One DID per owner, format-checked on registration
 * - Bounded, append-only credential list per identity
 * - Reversible deactivation and permanent revocation
 * - Two-step ownership transfer with a height-based expiry window
 * - Bounded transfer history per recipient
 *
 * Every mutating operation runs in its own {@link RegistryTransaction}: it
 * either commits all of its writes or, when it throws {@link RegistryException},
 * none of them. Read operations never throw for missing data.
 *
 * Not thread-safe. The host serializes mutating calls and fences reads
 * against them.
 */
public class DidRegistry {

    private final RegistryStore store;
    private final IdentityRegistry identityRegistry;
    private final LifecycleManager lifecycleManager;
    private final CredentialVault credentialVault;
    private final TransferHistoryLog transferHistoryLog;
    private final TransferCoordinator transferCoordinator;
    private final List<RegistryEventListener> listeners = new CopyOnWriteArrayList<>();

    public DidRegistry() {
        this(new RegistryStore(), RegistrySettings.defaults());
    }

    public DidRegistry(RegistryStore store, RegistrySettings settings) {
        this.store = Objects.requireNonNull(store);
        this.identityRegistry = new IdentityRegistry(settings);
        this.lifecycleManager = new LifecycleManager(identityRegistry);
        this.credentialVault = new CredentialVault(identityRegistry, lifecycleManager);
        this.transferHistoryLog = new TransferHistoryLog();
        this.transferCoordinator = new TransferCoordinator(identityRegistry, lifecycleManager, transferHistoryLog);
    }

    public void addListener(RegistryEventListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    // ==================== Identity ====================

    public void createDid(LedgerContext context, String did) {
        execute(tx -> identityRegistry.createDid(tx, context, did));
    }

    public Optional<IdentityRecord> getDid(Owner owner) {
        return identityRegistry.getDid(store.begin(), owner);
    }

    public void revokeDid(LedgerContext context) {
        execute(tx -> identityRegistry.revokeDid(tx, context));
    }

    // ==================== Credentials ====================

    public void addCredential(LedgerContext context, String credential) {
        execute(tx -> credentialVault.addCredential(tx, context, credential));
    }

    public boolean verifyCredential(Owner owner, String credential) {
        return credentialVault.verifyCredential(store.begin(), owner, credential);
    }

    public int getCredentialCount(Owner owner) {
        return credentialVault.getCredentialCount(store.begin(), owner);
    }

    // ==================== Lifecycle ====================

    public void deactivateDid(LedgerContext context, String reason) {
        execute(tx -> lifecycleManager.deactivateDid(tx, context, reason));
    }

    public void reactivateDid(LedgerContext context) {
        execute(tx -> lifecycleManager.reactivateDid(tx, context));
    }

    public boolean isDidActive(Owner owner) {
        return lifecycleManager.isDidActive(store.begin(), owner);
    }

    // ==================== Transfers ====================

    public void initiateTransfer(LedgerContext context, Owner newOwner) {
        execute(tx -> transferCoordinator.initiateTransfer(tx, context, newOwner));
    }

    public void cancelTransfer(LedgerContext context) {
        execute(tx -> transferCoordinator.cancelTransfer(tx, context));
    }

    public void acceptTransfer(LedgerContext context, Owner currentOwner) {
        execute(tx -> transferCoordinator.acceptTransfer(tx, context, currentOwner));
    }

    public Optional<PendingTransfer> getPendingTransfer(Owner owner) {
        return transferCoordinator.getPendingTransfer(store.begin(), owner);
    }

    /**
     * Whether the owner's pending transfer has expired at the given height.
     */
    public boolean isTransferExpired(Owner owner, long height) {
        return transferCoordinator.isTransferExpired(store.begin(), owner, height);
    }

    public List<TransferHistoryEntry> getTransferHistory(Owner owner) {
        return transferHistoryLog.getTransferHistory(store.begin(), owner);
    }

    // ==================== Private Methods ====================

    private void execute(Consumer<RegistryTransaction> operation) {
        RegistryTransaction tx = store.begin();
        operation.accept(tx);
        List<RegistryEvent> events = tx.commit();
        for (RegistryEvent event : events) {
            for (RegistryEventListener listener : listeners) {
                listener.onEvent(event);
            }
        }
    }
}
