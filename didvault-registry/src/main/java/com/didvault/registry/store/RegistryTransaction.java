package com.didvault.registry.store;

import com.didvault.registry.Owner;
import com.didvault.registry.RegistryLimits;
import com.didvault.registry.event.RegistryEvent;
import com.didvault.registry.identity.IdentityRecord;
import com.didvault.registry.transfer.PendingTransfer;
import com.didvault.registry.transfer.TransferHistoryEntry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Staged view over a {@link RegistryStore}.
 *
 * Reads see the transaction's own writes. Writes reach the underlying stores
 * only through {@link #commit()}; a transaction that is abandoned leaves them
 * untouched. A transaction commits at most once.
 */
public final class RegistryTransaction {

    private final StagedStore<Owner, IdentityRecord> identities;
    private final StagedStore<Owner, PendingTransfer> pendingTransfers;
    private final StagedStore<Owner, BoundedSequence<TransferHistoryEntry>> transferHistory;
    private final List<RegistryEvent> events = new ArrayList<>();
    private boolean committed;

    RegistryTransaction(RegistryStore store) {
        this.identities = new StagedStore<>(store.identities());
        this.pendingTransfers = new StagedStore<>(store.pendingTransfers());
        this.transferHistory = new StagedStore<>(store.transferHistory());
    }

    public Optional<IdentityRecord> identity(Owner owner) {
        return identities.get(owner);
    }

    public void putIdentity(Owner owner, IdentityRecord record) {
        ensureOpen();
        identities.put(owner, record);
    }

    public void deleteIdentity(Owner owner) {
        ensureOpen();
        identities.delete(owner);
    }

    public Optional<PendingTransfer> pendingTransfer(Owner owner) {
        return pendingTransfers.get(owner);
    }

    public void putPendingTransfer(Owner owner, PendingTransfer transfer) {
        ensureOpen();
        pendingTransfers.put(owner, transfer);
    }

    public void deletePendingTransfer(Owner owner) {
        ensureOpen();
        pendingTransfers.delete(owner);
    }

    /**
     * Transfer history of the owner, empty when none has been recorded.
     */
    public BoundedSequence<TransferHistoryEntry> transferHistory(Owner owner) {
        return transferHistory.get(owner)
                .orElseGet(() -> BoundedSequence.empty(RegistryLimits.MAX_TRANSFER_HISTORY));
    }

    public void putTransferHistory(Owner owner, BoundedSequence<TransferHistoryEntry> history) {
        ensureOpen();
        transferHistory.put(owner, history);
    }

    public void deleteTransferHistory(Owner owner) {
        ensureOpen();
        transferHistory.delete(owner);
    }

    /**
     * Queues an event for delivery once the transaction commits.
     */
    public void emit(RegistryEvent event) {
        ensureOpen();
        events.add(Objects.requireNonNull(event, "Event cannot be null"));
    }

    public boolean hasPendingWrites() {
        return identities.isDirty() || pendingTransfers.isDirty() || transferHistory.isDirty();
    }

    /**
     * Applies every staged write and returns the events emitted in order.
     */
    public List<RegistryEvent> commit() {
        ensureOpen();
        committed = true;
        identities.apply();
        pendingTransfers.apply();
        transferHistory.apply();
        return List.copyOf(events);
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("Transaction already committed");
        }
    }

    private static final class StagedStore<K, V> {

        private final KeyValueStore<K, V> target;
        private final Map<K, V> puts = new LinkedHashMap<>();
        private final Set<K> deletes = new HashSet<>();

        StagedStore(KeyValueStore<K, V> target) {
            this.target = target;
        }

        Optional<V> get(K key) {
            Objects.requireNonNull(key, "Key cannot be null");
            if (deletes.contains(key)) {
                return Optional.empty();
            }
            V staged = puts.get(key);
            return staged != null ? Optional.of(staged) : target.get(key);
        }

        void put(K key, V value) {
            Objects.requireNonNull(key, "Key cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
            deletes.remove(key);
            puts.put(key, value);
        }

        void delete(K key) {
            Objects.requireNonNull(key, "Key cannot be null");
            puts.remove(key);
            deletes.add(key);
        }

        boolean isDirty() {
            return !puts.isEmpty() || !deletes.isEmpty();
        }

        void apply() {
            deletes.forEach(target::delete);
            puts.forEach(target::put);
        }
    }
}
