package com.didvault.registry.transfer;

import com.didvault.registry.Owner;
import com.didvault.registry.RegistryErrorCode;
import com.didvault.registry.RegistryException;
import com.didvault.registry.RegistryLimits;
import com.didvault.registry.store.BoundedSequence;
import com.didvault.registry.store.RegistryTransaction;

import java.util.List;

/**
 * Per-owner log of acquired identities, capped at
 * {@link RegistryLimits#MAX_TRANSFER_HISTORY} entries. A full log rejects
 * further entries instead of rotating.
 */
public class TransferHistoryLog {

    public void append(RegistryTransaction tx, Owner recipient, TransferHistoryEntry entry) {
        BoundedSequence<TransferHistoryEntry> history = tx.transferHistory(recipient);
        if (history.isFull()) {
            throw new RegistryException(RegistryErrorCode.HISTORY_FULL,
                    "Transfer history of " + recipient + " already holds "
                            + RegistryLimits.MAX_TRANSFER_HISTORY + " entries");
        }
        tx.putTransferHistory(recipient, history.append(entry));
    }

    public List<TransferHistoryEntry> getTransferHistory(RegistryTransaction tx, Owner owner) {
        return tx.transferHistory(owner).asList();
    }
}
