package com.didvault.registry.store;

import java.util.Optional;

/**
 * Keyed storage capability the registry persists into. No iteration over keys
 * is offered or needed.
 */
public interface KeyValueStore<K, V> {

    Optional<V> get(K key);

    void put(K key, V value);

    void delete(K key);

    default boolean containsKey(K key) {
        return get(key).isPresent();
    }
}
