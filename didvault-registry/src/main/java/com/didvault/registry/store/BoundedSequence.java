package com.didvault.registry.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered sequence with a fixed capacity.
 *
 * Appending to a full sequence is rejected; elements are never dropped or
 * rotated to make room.
 */
public final class BoundedSequence<T> implements Iterable<T> {

    private final int capacity;
    private final List<T> elements;

    private BoundedSequence(int capacity, List<T> elements) {
        this.capacity = capacity;
        this.elements = elements;
    }

    public static <T> BoundedSequence<T> empty(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        return new BoundedSequence<>(capacity, List.of());
    }

    public static <T> BoundedSequence<T> of(int capacity, List<T> elements) {
        Objects.requireNonNull(elements, "Elements cannot be null");
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        if (elements.size() > capacity) {
            throw new IllegalArgumentException(
                    "Sequence of " + elements.size() + " elements exceeds capacity " + capacity);
        }
        return new BoundedSequence<>(capacity, List.copyOf(elements));
    }

    /**
     * Returns a new sequence with the element added at the end.
     *
     * @throws IllegalStateException if the sequence is full
     */
    public BoundedSequence<T> append(T element) {
        Objects.requireNonNull(element, "Element cannot be null");
        if (isFull()) {
            throw new IllegalStateException("Sequence is at capacity " + capacity);
        }
        List<T> copy = new ArrayList<>(elements.size() + 1);
        copy.addAll(elements);
        copy.add(element);
        return new BoundedSequence<>(capacity, Collections.unmodifiableList(copy));
    }

    public boolean isFull() {
        return elements.size() >= capacity;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public boolean contains(Object element) {
        return elements.contains(element);
    }

    public T get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public int capacity() {
        return capacity;
    }

    public int remaining() {
        return capacity - elements.size();
    }

    public List<T> asList() {
        return elements;
    }

    @Override
    public Iterator<T> iterator() {
        return elements.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundedSequence<?> other)) return false;
        return capacity == other.capacity && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, elements);
    }

    @Override
    public String toString() {
        return elements + "/" + capacity;
    }
}
