package com.didvault.registry.transfer;

import com.didvault.registry.LedgerContext;
import com.didvault.registry.Owner;
import com.didvault.registry.RegistryErrorCode;
import com.didvault.registry.RegistryException;
import com.didvault.registry.event.RegistryEvent;
import com.didvault.registry.event.RegistryEvent.EventType;
import com.didvault.registry.identity.IdentityRecord;
import com.didvault.registry.identity.IdentityRegistry;
import com.didvault.registry.identity.LifecycleManager;
import com.didvault.registry.store.RegistryTransaction;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Two-step ownership transfer.
 *
 * The current owner initiates a transfer naming the recipient; the recipient
 * accepts it within the transfer window. Accepting moves the identity record
 * to the recipient, records the transfer in the recipient's history and
 * clears the pending entry. An expired transfer is not removed automatically;
 * the owner cancels it.
 */
public class TransferCoordinator {

    private final IdentityRegistry identityRegistry;
    private final LifecycleManager lifecycleManager;
    private final TransferHistoryLog historyLog;

    public TransferCoordinator(
            IdentityRegistry identityRegistry,
            LifecycleManager lifecycleManager,
            TransferHistoryLog historyLog) {
        this.identityRegistry = Objects.requireNonNull(identityRegistry);
        this.lifecycleManager = Objects.requireNonNull(lifecycleManager);
        this.historyLog = Objects.requireNonNull(historyLog);
    }

    public void initiateTransfer(RegistryTransaction tx, LedgerContext context, Owner newOwner) {
        Objects.requireNonNull(newOwner, "New owner cannot be null");
        Owner caller = context.caller();
        IdentityRecord record = identityRegistry.require(tx, caller);
        lifecycleManager.requireActive(record, caller);
        if (tx.pendingTransfer(caller).isPresent()) {
            throw new RegistryException(RegistryErrorCode.TRANSFER_IN_PROGRESS,
                    "Transfer already pending for " + caller);
        }
        if (newOwner.equals(caller)) {
            throw new RegistryException(RegistryErrorCode.SELF_TRANSFER);
        }
        if (tx.identity(newOwner).isPresent()) {
            throw new RegistryException(RegistryErrorCode.ALREADY_EXISTS,
                    "Recipient " + newOwner + " already holds an identity");
        }

        PendingTransfer transfer = PendingTransfer.open(newOwner, context.height());
        tx.putPendingTransfer(caller, transfer);
        tx.emit(RegistryEvent.of(EventType.TRANSFER_INITIATED, caller, context.height(), Map.of(
                "newOwner", newOwner.principal(),
                "expiresAt", String.valueOf(transfer.expiresAt()))));
    }

    public void cancelTransfer(RegistryTransaction tx, LedgerContext context) {
        Owner caller = context.caller();
        PendingTransfer transfer = tx.pendingTransfer(caller)
                .orElseThrow(() -> new RegistryException(RegistryErrorCode.NO_PENDING_TRANSFER,
                        "No pending transfer for " + caller));

        tx.deletePendingTransfer(caller);
        tx.emit(RegistryEvent.of(EventType.TRANSFER_CANCELLED, caller, context.height(),
                Map.of("newOwner", transfer.newOwner().principal())));
    }

    /**
     * Accepts the transfer offered by {@code currentOwner} to the caller.
     * The caller's existing record, if any, is overwritten unless it is
     * deactivated.
     */
    public void acceptTransfer(RegistryTransaction tx, LedgerContext context, Owner currentOwner) {
        Objects.requireNonNull(currentOwner, "Current owner cannot be null");
        Owner caller = context.caller();
        long height = context.height();

        PendingTransfer transfer = tx.pendingTransfer(currentOwner)
                .orElseThrow(() -> new RegistryException(RegistryErrorCode.NOT_FOUND,
                        "No pending transfer from " + currentOwner));
        IdentityRecord record = identityRegistry.require(tx, currentOwner);
        if (!transfer.newOwner().equals(caller)) {
            throw new RegistryException(RegistryErrorCode.UNAUTHORIZED,
                    caller + " is not the recipient of the transfer from " + currentOwner);
        }
        lifecycleManager.requireActive(record, currentOwner);
        if (transfer.isExpiredAt(height)) {
            throw new RegistryException(RegistryErrorCode.TRANSFER_EXPIRED,
                    "Transfer from " + currentOwner + " expired at height " + transfer.expiresAt());
        }
        // A deactivated recipient identity is frozen and cannot be replaced
        tx.identity(caller).ifPresent(existing -> lifecycleManager.requireActive(existing, caller));

        historyLog.append(tx, caller, new TransferHistoryEntry(currentOwner, caller, height));
        tx.putIdentity(caller, record.transferredAt(height));
        tx.deleteIdentity(currentOwner);
        tx.deletePendingTransfer(currentOwner);
        tx.emit(RegistryEvent.of(EventType.TRANSFER_ACCEPTED, caller, height, Map.of(
                "from", currentOwner.principal(),
                "did", record.did())));
    }

    public Optional<PendingTransfer> getPendingTransfer(RegistryTransaction tx, Owner owner) {
        return tx.pendingTransfer(owner);
    }

    /**
     * False when the owner has no pending transfer.
     */
    public boolean isTransferExpired(RegistryTransaction tx, Owner owner, long height) {
        return tx.pendingTransfer(owner)
                .map(transfer -> transfer.isExpiredAt(height))
                .orElse(false);
    }
}
