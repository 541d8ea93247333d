package com.didvault.registry.event;

import com.didvault.registry.Owner;

import java.util.Map;
import java.util.Objects;

/**
 * State change committed by the registry.
 *
 * @param type    what happened
 * @param subject owner whose store entries changed
 * @param height  ledger height of the operation
 * @param details type-specific attributes (did, counterparty, reason, ...)
 */
public record RegistryEvent(
        EventType type,
        Owner subject,
        long height,
        Map<String, String> details
) {
    public RegistryEvent {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(subject, "Subject cannot be null");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static RegistryEvent of(EventType type, Owner subject, long height) {
        return new RegistryEvent(type, subject, height, Map.of());
    }

    public static RegistryEvent of(EventType type, Owner subject, long height, Map<String, String> details) {
        return new RegistryEvent(type, subject, height, details);
    }

    public enum EventType {
        DID_CREATED,
        DID_REVOKED,
        CREDENTIAL_ADDED,
        DID_DEACTIVATED,
        DID_REACTIVATED,
        TRANSFER_INITIATED,
        TRANSFER_CANCELLED,
        TRANSFER_ACCEPTED,
        ORPHANED_STATE_PURGED
    }
}
