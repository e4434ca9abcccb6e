package org.ftlbuffer.runtime.cache;

/**
 * A snapshot of cache usage.
 *
 * @param size    The number of cached entries.
 * @param maxSize The capacity.
 * @param hits    Lookups that found an entry.
 * @param misses  Lookups that found nothing.
 */
public record CacheStats(int size, int maxSize, long hits, long misses) {

    /**
     * @return Hits as a percentage of all lookups, 0 if there were none.
     */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : hits * 100.0 / total;
    }
}
