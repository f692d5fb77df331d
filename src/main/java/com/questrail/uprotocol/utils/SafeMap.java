package com.questrail.uprotocol.utils;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * SafeMap
 * =============================================================================
 * Map guarded by a read/write lock.
 *
 * <p>
 * The backing {@link HashMap} is private and never escapes. Single-key
 * operations lock internally. Anything that must see or change several entries
 * atomically goes through {@link #read(Function)} (shared lock, read-only view)
 * or {@link #transact(Function)} (exclusive lock, mutable view). Neither view
 * may be retained after the function returns.
 * </p>
 *
 * <p>Null keys and values are rejected.</p>
 */
public final class SafeMap<K, V>
{
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<K, V> map;

    public SafeMap() {
        this.map = new HashMap<>();
    }

    public SafeMap(Map<? extends K, ? extends V> initial) {
        Objects.requireNonNull(initial, "initial");
        initial.forEach((k, v) -> {
            Objects.requireNonNull(k, "key");
            Objects.requireNonNull(v, "value");
        });
        this.map = new HashMap<>(initial);
    }

    /**
     * Copies {@code other} while holding its read lock.
     */
    public SafeMap(SafeMap<? extends K, ? extends V> other) {
        Objects.requireNonNull(other, "other");
        this.map = new HashMap<>(other.snapshot());
    }

    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");
        return read(m -> Optional.ofNullable(m.get(key)));
    }

    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "key");
        return read(m -> m.containsKey(key));
    }

    /**
     * @return the previous value, if any
     */
    public Optional<V> put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        return transact(m -> Optional.ofNullable(m.put(key, value)));
    }

    /**
     * @return {@code true} if the value was stored
     */
    public boolean putIfAbsent(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        return transact(m -> m.putIfAbsent(key, value) == null);
    }

    public Optional<V> remove(K key) {
        Objects.requireNonNull(key, "key");
        return transact(m -> Optional.ofNullable(m.remove(key)));
    }

    public int size() {
        return read(Map::size);
    }

    public boolean isEmpty() {
        return read(Map::isEmpty);
    }

    public void clear() {
        transact(m -> {
            m.clear();
            return null;
        });
    }

    /**
     * Returns an independent copy of the current contents.
     */
    public Map<K, V> snapshot() {
        return read(m -> new HashMap<>(m));
    }

    /**
     * Runs {@code operation} against a read-only view under the shared lock.
     */
    public <R> R read(Function<? super Map<K, V>, ? extends R> operation) {
        Objects.requireNonNull(operation, "operation");
        ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return operation.apply(Collections.unmodifiableMap(map));
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Runs {@code operation} against the backing map under the exclusive lock.
     * Entries added inside the transaction must not be null.
     */
    public <R> R transact(Function<? super Map<K, V>, ? extends R> operation) {
        Objects.requireNonNull(operation, "operation");
        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return operation.apply(map);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "SafeMap" + snapshot();
    }
}
