package flaglite.core.cache;

/**
 * A cached decision and the ticker reading at which it was written.
 */
record CacheEntry(boolean value, long writtenAtNanos) {

    boolean isLive(long nowNanos, long ttlNanos) {
        return nowNanos - writtenAtNanos <= ttlNanos;
    }
}
