package com.didvault.api.registry;

import com.didvault.ledger.LedgerUnavailableException;
import com.didvault.registry.DidRegistry;
import com.didvault.registry.Owner;
import com.didvault.registry.RegistryErrorCode;
import com.didvault.registry.RegistryException;
import com.didvault.registry.RegistryLimits;
import com.didvault.registry.identity.IdentityRecord;
import com.didvault.registry.transfer.PendingTransfer;
import net.jqwik.api.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the single-writer registry host.
 */
class IdentityRegistryServiceTest {

    private static final Owner ALICE = Owner.of("SP2ALICE");
    private static final Owner BOB = Owner.of("SP3BOB");

    private AtomicLong height;
    private IdentityRegistryService service;

    @BeforeEach
    void setUp() {
        height = new AtomicLong(100);
        service = new IdentityRegistryService(new DidRegistry(), height::get);
    }

    @Test
    void mutations_useCurrentLedgerHeight() {
        service.createDid(ALICE, "did:stx:alice");
        height.set(130);
        service.addCredential(ALICE, "kyc:level-1");

        IdentityRecord record = service.getDid(ALICE).orElseThrow();
        assertThat(record.createdAt()).isEqualTo(100);
        assertThat(record.updatedAt()).isEqualTo(130);
    }

    @Test
    void transferExpiry_followsLedgerHeight() {
        service.createDid(ALICE, "did:stx:alice");
        service.initiateTransfer(ALICE, BOB);

        height.set(100 + RegistryLimits.TRANSFER_WINDOW);
        assertThat(service.isTransferExpired(ALICE)).isFalse();

        height.set(101 + RegistryLimits.TRANSFER_WINDOW);
        assertThat(service.isTransferExpired(ALICE)).isTrue();
        assertThatThrownBy(() -> service.acceptTransfer(BOB, ALICE))
                .isInstanceOf(RegistryException.class);
    }

    @Test
    void ledgerFailure_leavesRegistryUntouched() {
        IdentityRegistryService failing = new IdentityRegistryService(new DidRegistry(), () -> {
            throw new LedgerUnavailableException("node down");
        });

        assertThatThrownBy(() -> failing.createDid(ALICE, "did:stx:alice"))
                .isInstanceOf(LedgerUnavailableException.class);
        assertThat(failing.getDid(ALICE)).isEmpty();
    }

    @Test
    void concurrentCredentialWrites_neverExceedCapacity() throws Exception {
        service.createDid(ALICE, "did:stx:alice");
        int threads = 16;
        int attemptsPerThread = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        ConcurrentLinkedQueue<RegistryErrorCode> rejections = new ConcurrentLinkedQueue<>();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < attemptsPerThread; i++) {
                        try {
                            service.addCredential(ALICE, "cred-" + thread + "-" + i);
                            accepted.incrementAndGet();
                        } catch (RegistryException e) {
                            rejections.add(e.getErrorCode());
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(accepted.get()).isEqualTo(RegistryLimits.MAX_CREDENTIALS);
        assertThat(rejections).hasSize(threads * attemptsPerThread - RegistryLimits.MAX_CREDENTIALS)
                .containsOnly(RegistryErrorCode.MAX_CREDENTIALS);
        assertThat(service.getCredentialCount(ALICE)).isEqualTo(RegistryLimits.MAX_CREDENTIALS);
    }

    @Test
    void concurrentAcceptance_onlyRecipientSucceedsOnce() throws Exception {
        service.createDid(ALICE, "did:stx:alice");
        service.initiateTransfer(ALICE, BOB);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicInteger accepted = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    try {
                        service.acceptTransfer(BOB, ALICE);
                        accepted.incrementAndGet();
                    } catch (RegistryException e) {
                        assertThat(e.getErrorCode()).isEqualTo(RegistryErrorCode.NOT_FOUND);
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(accepted.get()).isEqualTo(1);
        assertThat(service.getTransferHistory(BOB)).hasSize(1);
        assertThat(service.getDid(ALICE)).isEmpty();
    }

    @Test
    void mutations_returnCommittedState() {
        IdentityRecord created = service.createDid(ALICE, "did:stx:alice");
        int count = service.addCredential(ALICE, "kyc:level-1");
        PendingTransfer transfer = service.initiateTransfer(ALICE, BOB);

        assertThat(created.did()).isEqualTo("did:stx:alice");
        assertThat(created.createdAt()).isEqualTo(100);
        assertThat(count).isEqualTo(1);
        assertThat(transfer.newOwner()).isEqualTo(BOB);
        assertThat(transfer.expiresAt()).isEqualTo(100 + RegistryLimits.TRANSFER_WINDOW);
    }

    @Test
    void createResult_unaffectedByConcurrentRevocation() throws Exception {
        int rounds = 200;
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Integer> creator = executor.submit(() -> {
                int created = 0;
                for (int i = 0; i < rounds; i++) {
                    try {
                        IdentityRecord record = service.createDid(ALICE, "did:stx:alice");
                        assertThat(record.did()).isEqualTo("did:stx:alice");
                        created++;
                    } catch (RegistryException e) {
                        assertThat(e.getErrorCode()).isEqualTo(RegistryErrorCode.ALREADY_EXISTS);
                    }
                }
                return created;
            });
            Future<?> revoker = executor.submit(() -> {
                for (int i = 0; i < rounds; i++) {
                    try {
                        service.revokeDid(ALICE);
                    } catch (RegistryException e) {
                        assertThat(e.getErrorCode()).isEqualTo(RegistryErrorCode.NOT_FOUND);
                    }
                }
                return null;
            });

            assertThat(creator.get(30, TimeUnit.SECONDS)).isPositive();
            revoker.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    // ==================== Random operation sequences ====================

    /**
     * Property: any sequence of operations leaves every stored value within its bounds.
     */
    @Property(tries = 200)
    void randomOperationSequences_keepStateWithinBounds(@ForAll("operationSequences") List<Operation> operations) {
        AtomicLong clock = new AtomicLong();
        IdentityRegistryService service = new IdentityRegistryService(new DidRegistry(), clock::incrementAndGet);

        for (Operation operation : operations) {
            try {
                operation.applyTo(service);
            } catch (RegistryException e) {
                // rejected operations are part of the sequence
            }
            for (int i = 0; i < Operation.ACTORS; i++) {
                assertWithinBounds(service, Operation.actor(i));
            }
        }
    }

    @Provide
    Arbitrary<List<Operation>> operationSequences() {
        Arbitrary<Operation> operation = Combinators.combine(
                Arbitraries.of(OperationKind.class),
                Arbitraries.integers().between(0, Operation.ACTORS - 1),
                Arbitraries.integers().between(0, Operation.ACTORS - 1),
                Arbitraries.integers().between(0, 12)
        ).as(Operation::new);
        return operation.list().ofMaxSize(80);
    }

    private static void assertWithinBounds(IdentityRegistryService service, Owner owner) {
        assertThat(service.getCredentialCount(owner)).isBetween(0, RegistryLimits.MAX_CREDENTIALS);
        assertThat(service.getTransferHistory(owner)).hasSizeLessThanOrEqualTo(RegistryLimits.MAX_TRANSFER_HISTORY);
        service.getDid(owner).ifPresent(record -> {
            assertThat(record.updatedAt()).isGreaterThanOrEqualTo(record.createdAt());
            if (record.active()) {
                assertThat(record.revocationReason()).isNull();
            }
        });
        service.getPendingTransfer(owner).ifPresent(transfer -> {
            assertThat(transfer.newOwner()).isNotEqualTo(owner);
            assertThat(transfer.expiresAt()).isEqualTo(transfer.initiatedAt() + RegistryLimits.TRANSFER_WINDOW);
        });
    }

    enum OperationKind {
        CREATE, ADD_CREDENTIAL, DEACTIVATE, REACTIVATE, REVOKE, INITIATE, CANCEL, ACCEPT
    }

    record Operation(OperationKind kind, int actor, int target, int value) {

        static final int ACTORS = 4;

        static Owner actor(int index) {
            return Owner.of("SPACTOR" + index);
        }

        void applyTo(IdentityRegistryService service) {
            Owner caller = actor(actor);
            Owner other = actor(target);
            switch (kind) {
                case CREATE -> service.createDid(caller, "did:stx:actor-" + actor);
                case ADD_CREDENTIAL -> service.addCredential(caller, "cred-" + value);
                case DEACTIVATE -> service.deactivateDid(caller, value % 2 == 0 ? null : "reason-" + value);
                case REACTIVATE -> service.reactivateDid(caller);
                case REVOKE -> service.revokeDid(caller);
                case INITIATE -> service.initiateTransfer(caller, other);
                case CANCEL -> service.cancelTransfer(caller);
                case ACCEPT -> service.acceptTransfer(caller, other);
            }
        }
    }
}
