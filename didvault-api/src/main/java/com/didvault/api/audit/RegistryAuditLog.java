package com.didvault.api.audit;

import com.didvault.registry.event.RegistryEvent;
import com.didvault.registry.event.RegistryEventListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hash-chained, append-only log of committed registry events.
 *
 * Each entry hashes its sequence number, the previous entry's hash and the
 * event, so editing, dropping or reordering entries breaks the chain.
 */
@Component
public class RegistryAuditLog implements RegistryEventListener {

    static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private volatile String lastHash = GENESIS_HASH;

    @Override
    public void onEvent(RegistryEvent event) {
        append(event);
    }

    public synchronized AuditEntry append(RegistryEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");

        long sequenceNumber = entries.size();
        String previousHash = lastHash;
        Instant recordedAt = Instant.now();
        String entryHash = computeEntryHash(sequenceNumber, previousHash, event, recordedAt);

        AuditEntry entry = new AuditEntry(sequenceNumber, event, recordedAt, previousHash, entryHash);
        entries.add(entry);
        lastHash = entryHash;
        return entry;
    }

    public List<AuditEntry> getEntries() {
        return new ArrayList<>(entries);
    }

    /**
     * Gets the latest N entries.
     */
    public List<AuditEntry> getLatestEntries(int count) {
        List<AuditEntry> snapshot = getEntries();
        int start = Math.max(0, snapshot.size() - Math.max(0, count));
        return snapshot.subList(start, snapshot.size());
    }

    public int size() {
        return entries.size();
    }

    public VerificationResult verifyIntegrity() {
        return verifyChain(getEntries());
    }

    /**
     * Recomputes the hash chain over the given entries.
     */
    public static VerificationResult verifyChain(List<AuditEntry> chain) {
        List<String> errors = new ArrayList<>();
        String expectedPrevHash = GENESIS_HASH;

        for (int i = 0; i < chain.size(); i++) {
            AuditEntry entry = chain.get(i);

            if (entry.sequenceNumber() != i) {
                errors.add("Sequence number mismatch at index " + i);
            }
            if (!entry.previousHash().equals(expectedPrevHash)) {
                errors.add("Previous hash mismatch at index " + i);
            }
            String computedHash = computeEntryHash(
                    entry.sequenceNumber(), entry.previousHash(), entry.event(), entry.recordedAt());
            if (!entry.entryHash().equals(computedHash)) {
                errors.add("Entry hash mismatch at index " + i);
            }
            expectedPrevHash = entry.entryHash();
        }

        return new VerificationResult(errors.isEmpty(), errors, chain.size());
    }

    private static String computeEntryHash(long sequenceNumber, String previousHash,
                                           RegistryEvent event, Instant recordedAt) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            // Sorted so the digest does not depend on map iteration order
            Map<String, String> details = new TreeMap<>(event.details());
            String data = sequenceNumber + "|" + previousHash + "|"
                    + event.type() + "|" + event.subject() + "|" + event.height() + "|"
                    + details + "|" + recordedAt.toEpochMilli();
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ==================== Inner Types ====================

    public record AuditEntry(
            long sequenceNumber,
            RegistryEvent event,
            Instant recordedAt,
            String previousHash,
            String entryHash
    ) {
        public AuditEntry {
            Objects.requireNonNull(event, "Event cannot be null");
            Objects.requireNonNull(recordedAt, "Recorded-at cannot be null");
            Objects.requireNonNull(previousHash, "Previous hash cannot be null");
            Objects.requireNonNull(entryHash, "Entry hash cannot be null");
        }
    }

    public record VerificationResult(
            boolean valid,
            List<String> errors,
            int entriesVerified
    ) {
        public VerificationResult {
            errors = errors != null ? List.copyOf(errors) : List.of();
        }
    }
}
