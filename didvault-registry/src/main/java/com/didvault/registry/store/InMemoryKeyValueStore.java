package com.didvault.registry.store;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link KeyValueStore}.
 */
public class InMemoryKeyValueStore<K, V> implements KeyValueStore<K, V> {

    private final Map<K, V> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(K key, V value) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        entries.put(key, value);
    }

    @Override
    public void delete(K key) {
        Objects.requireNonNull(key, "Key cannot be null");
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }
}
