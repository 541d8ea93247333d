package com.didvault.registry.store;

import com.didvault.registry.Owner;
import com.didvault.registry.identity.IdentityRecord;
import com.didvault.registry.transfer.PendingTransfer;
import com.didvault.registry.transfer.TransferHistoryEntry;

import java.util.Objects;

/**
 * The three owner-keyed stores behind the registry.
 */
public class RegistryStore {

    private final KeyValueStore<Owner, IdentityRecord> identities;
    private final KeyValueStore<Owner, PendingTransfer> pendingTransfers;
    private final KeyValueStore<Owner, BoundedSequence<TransferHistoryEntry>> transferHistory;

    public RegistryStore() {
        this(new InMemoryKeyValueStore<>(), new InMemoryKeyValueStore<>(), new InMemoryKeyValueStore<>());
    }

    public RegistryStore(
            KeyValueStore<Owner, IdentityRecord> identities,
            KeyValueStore<Owner, PendingTransfer> pendingTransfers,
            KeyValueStore<Owner, BoundedSequence<TransferHistoryEntry>> transferHistory) {
        this.identities = Objects.requireNonNull(identities);
        this.pendingTransfers = Objects.requireNonNull(pendingTransfers);
        this.transferHistory = Objects.requireNonNull(transferHistory);
    }

    /**
     * Opens a transaction. Nothing it writes is visible here until it commits.
     */
    public RegistryTransaction begin() {
        return new RegistryTransaction(this);
    }

    KeyValueStore<Owner, IdentityRecord> identities() {
        return identities;
    }

    KeyValueStore<Owner, PendingTransfer> pendingTransfers() {
        return pendingTransfers;
    }

    KeyValueStore<Owner, BoundedSequence<TransferHistoryEntry>> transferHistory() {
        return transferHistory;
    }
}
