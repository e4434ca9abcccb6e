package org.ftlbuffer.runtime.cache;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A thread-safe, size-bounded cache of formatting results that evicts the least recently used entry.
 * <p>
 * Entries are keyed by message id, arguments (order-independent), attribute and locale, so the
 * cache must be cleared whenever the messages or functions behind those keys change.
 * <p>
 * Only argument maps accepted by {@link #isCacheable(Map)} are cached; for any other map
 * {@link #get} always misses without counting and {@link #put} does nothing.
 *
 * @param <V> The cached result type.
 */
public class FormatCache<V> {

    private static final Set<Class<?>> IMMUTABLE_VALUE_TYPES = Set.of(
            String.class, Boolean.class, Character.class,
            Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
            BigDecimal.class, BigInteger.class);

    private final int maxSize;
    private final Map<Key, V> entries;
    private final Lock lock = new ReentrantLock();
    private long hits;
    private long misses;

    /**
     * @param maxSize The maximum number of entries, must be positive.
     */
    public FormatCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, V> eldest) {
                return size() > FormatCache.this.maxSize;
            }
        };
    }

    /**
     * Looks up a result and marks it as recently used.
     * @return The cached result, or empty.
     */
    public Optional<V> get(String messageId, Map<String, ?> args, String attribute, String locale) {
        if (!isCacheable(args)) {
            return Optional.empty();
        }
        Key key = Key.of(messageId, args, attribute, locale);
        lock.lock();
        try {
            V value = entries.get(key);
            if (value == null) {
                misses++;
            } else {
                hits++;
            }
            return Optional.ofNullable(value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a result, evicting the least recently used entry when the cache is full.
     */
    public void put(String messageId, Map<String, ?> args, String attribute, String locale, V value) {
        Objects.requireNonNull(value, "value");
        if (!isCacheable(args)) {
            return;
        }
        Key key = Key.of(messageId, args, attribute, locale);
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all entries and resets the statistics.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
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

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(entries.size(), maxSize, hits, misses);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Decides whether results for these arguments may be cached. Keys must not be {@code null} and
     * every value must be {@code null}, a string, a boolean, a character, a JDK number type or a
     * {@code java.time} value, so that a cached key cannot change after it was stored.
     *
     * @param args The formatting arguments, may be {@code null}.
     * @return {@code true} if the arguments can be part of a cache key.
     */
    public static boolean isCacheable(Map<String, ?> args) {
        if (args == null) {
            return true;
        }
        for (Map.Entry<String, ?> entry : args.entrySet()) {
            if (entry.getKey() == null) {
                return false;
            }
            Object value = entry.getValue();
            if (value != null && !IMMUTABLE_VALUE_TYPES.contains(value.getClass())
                    && !value.getClass().getPackageName().equals("java.time")) {
                return false;
            }
        }
        return true;
    }

    private record Key(String messageId, Map<String, Object> args, String attribute, String locale) {

        static Key of(String messageId, Map<String, ?> args, String attribute, String locale) {
            // Sorted copy so that argument order does not matter.
            Map<String, Object> sorted = args == null || args.isEmpty()
                    ? Map.of()
                    : Collections.unmodifiableMap(new TreeMap<>(args));
            return new Key(messageId, sorted, attribute, locale);
        }
    }
}
