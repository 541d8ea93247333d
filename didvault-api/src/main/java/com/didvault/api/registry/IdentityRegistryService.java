package com.didvault.api.registry;

import com.didvault.ledger.LedgerHeightSource;
import com.didvault.registry.DidRegistry;
import com.didvault.registry.LedgerContext;
import com.didvault.registry.Owner;
import com.didvault.registry.RegistryException;
import com.didvault.registry.identity.IdentityRecord;
import com.didvault.registry.transfer.PendingTransfer;
import com.didvault.registry.transfer.TransferHistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single-writer host for the identity registry.
 *
 * Mutations run one at a time under the write lock, each with the ledger
 * height read inside the lock, so heights seen by successive commits never
 * decrease. Reads share the read lock and never observe a partial commit.
 */
@Service
public class IdentityRegistryService {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistryService.class);

    private final DidRegistry registry;
    private final LedgerHeightSource heightSource;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public IdentityRegistryService(DidRegistry registry, LedgerHeightSource heightSource) {
        this.registry = registry;
        this.heightSource = heightSource;
    }

    // ==================== Identity ====================

    /**
     * Registers the DID and returns the record as committed.
     */
    public IdentityRecord createDid(Owner caller, String did) {
        return mutateAndGet("create-did", caller, context -> {
            registry.createDid(context, did);
            return registry.getDid(caller).orElseThrow();
        });
    }

    public Optional<IdentityRecord> getDid(Owner owner) {
        return read(() -> registry.getDid(owner));
    }

    public void revokeDid(Owner caller) {
        mutate("revoke-did", caller, registry::revokeDid);
    }

    // ==================== Credentials ====================

    /**
     * Adds the credential and returns the caller's credential count after the commit.
     */
    public int addCredential(Owner caller, String credential) {
        return mutateAndGet("add-credential", caller, context -> {
            registry.addCredential(context, credential);
            return registry.getCredentialCount(caller);
        });
    }

    public boolean verifyCredential(Owner owner, String credential) {
        return read(() -> registry.verifyCredential(owner, credential));
    }

    public int getCredentialCount(Owner owner) {
        return read(() -> registry.getCredentialCount(owner));
    }

    // ==================== Lifecycle ====================

    public void deactivateDid(Owner caller, String reason) {
        mutate("deactivate-did", caller, context -> registry.deactivateDid(context, reason));
    }

    public void reactivateDid(Owner caller) {
        mutate("reactivate-did", caller, registry::reactivateDid);
    }

    public boolean isDidActive(Owner owner) {
        return read(() -> registry.isDidActive(owner));
    }

    // ==================== Transfers ====================

    /**
     * Opens the transfer and returns it as committed.
     */
    public PendingTransfer initiateTransfer(Owner caller, Owner newOwner) {
        return mutateAndGet("initiate-transfer", caller, context -> {
            registry.initiateTransfer(context, newOwner);
            return registry.getPendingTransfer(caller).orElseThrow();
        });
    }

    public void cancelTransfer(Owner caller) {
        mutate("cancel-transfer", caller, registry::cancelTransfer);
    }

    public void acceptTransfer(Owner caller, Owner currentOwner) {
        mutate("accept-transfer", caller, context -> registry.acceptTransfer(context, currentOwner));
    }

    public Optional<PendingTransfer> getPendingTransfer(Owner owner) {
        return read(() -> registry.getPendingTransfer(owner));
    }

    /**
     * Whether the owner's pending transfer has expired at the current height.
     */
    public boolean isTransferExpired(Owner owner) {
        return read(() -> registry.isTransferExpired(owner, heightSource.currentHeight()));
    }

    public List<TransferHistoryEntry> getTransferHistory(Owner owner) {
        return read(() -> registry.getTransferHistory(owner));
    }

    public long currentHeight() {
        return heightSource.currentHeight();
    }

    // ==================== Private Methods ====================

    private void mutate(String operation, Owner caller, Consumer<LedgerContext> action) {
        mutateAndGet(operation, caller, context -> {
            action.accept(context);
            return null;
        });
    }

    /**
     * Runs the mutation and reads its result under the same write lock.
     */
    private <T> T mutateAndGet(String operation, Owner caller, Function<LedgerContext, T> action) {
        lock.writeLock().lock();
        try {
            LedgerContext context = LedgerContext.of(caller, heightSource.currentHeight());
            T result;
            try {
                result = action.apply(context);
            } catch (RegistryException e) {
                log.debug("{} by {} rejected at height {}: {}",
                        operation, caller, context.height(), e.getErrorCode());
                throw e;
            }
            log.info("{} by {} committed at height {}", operation, caller, context.height());
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
