package com.didvault.registry.event;

/**
 * Receives events after the transaction that produced them has committed.
 *
 * Implementations must not throw. A failure would still propagate to the
 * caller of the operation, whose state change has already committed.
 */
@FunctionalInterface
public interface RegistryEventListener {

    void onEvent(RegistryEvent event);
}
