package org.harmar.kv.store;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * String to string mapping shared by every connection.
 * All access goes through one lock held only around the single map operation.
 */
public class InMemoryStore {
    private final Map<String, String> entries = new HashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * insert or overwrite
     */
    public void set(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return current value, empty if never set or deleted
     */
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key");

        lock.lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * remove the key, absent key is a no-op
     */
    public void delete(String key) {
        Objects.requireNonNull(key, "key");

        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
