package flaglite.core.cache;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.github.benmanes.caffeine.cache.Ticker;

/**
 * TTL cache of flag decisions with lazy expiry.
 *
 * <p>
 * One storage map is exposed through two views:
 * <ul>
 *   <li>{@link #concurrent()} serializes every read and write behind a single
 *       lock owned by this instance. Use it from reactive pipelines and from
 *       any code that may run on more than one thread.</li>
 *   <li>{@link #singleThreaded()} takes no lock. It is only safe while a single
 *       thread accesses the cache and the concurrent view is not in use from
 *       another thread at the same time.</li>
 * </ul>
 *
 * <p>
 * Both views run the same operations against the same map, so a sequence of
 * calls gives the same results through either one.
 *
 * <p>
 * Time is read from a Caffeine {@link Ticker}, a monotonic nanosecond source.
 * An entry is live while {@code ticker.read() - writtenAt <= ttl}. TTLs too
 * long to count in nanoseconds are capped at {@link Long#MAX_VALUE}, which
 * keeps entries live for the life of the process.
 */
public class TtlFlagCache {

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final Map<CacheKey, CacheEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Duration ttl;
    private final long ttlNanos;
    private final Ticker ticker;

    private final FlagCache concurrentView = new LockingView();
    private final FlagCache singleThreadedView = new UnlockedView();

    /**
     * Create a cache reading time from the system ticker.
     *
     * @param ttl time-to-live for new entries, must not be negative
     */
    public TtlFlagCache(Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    /**
     * Create a cache with an explicit time source.
     *
     * @param ttl    time-to-live for new entries, must not be negative
     * @param ticker monotonic nanosecond time source
     */
    public TtlFlagCache(Duration ttl, Ticker ticker) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must not be negative, got: " + ttl);
        }
        this.ttl = ttl;
        this.ttlNanos = saturatedNanos(ttl);
        this.ticker = ticker;
    }

    /**
     * Lock-protected view, safe for concurrent callers.
     */
    public FlagCache concurrent() {
        return concurrentView;
    }

    /**
     * Lock-free view for a single non-concurrent caller.
     *
     * <p>Must not be used while {@link #concurrent()} is in use on this
     * instance from another thread; the underlying map is not thread-safe.
     */
    public FlagCache singleThreaded() {
        return singleThreadedView;
    }

    public Duration ttl() {
        return ttl;
    }

    private static long saturatedNanos(Duration ttl) {
        return ttl.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : ttl.toNanos();
    }

    private Optional<Boolean> read(CacheKey key) {
        final var entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isLive(ticker.read(), ttlNanos)) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    private void write(CacheKey key, boolean value) {
        entries.put(key, new CacheEntry(value, ticker.read()));
    }

    private int removeExpired() {
        final var now = ticker.read();
        var removed = 0;
        for (Iterator<CacheEntry> it = entries.values().iterator(); it.hasNext(); ) {
            if (!it.next().isLive(now, ttlNanos)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private class LockingView implements FlagCache {

        @Override
        public Optional<Boolean> get(String flagKey, String subject) {
            final var key = new CacheKey(flagKey, subject);
            return locked(() -> read(key));
        }

        @Override
        public void put(String flagKey, boolean value, String subject) {
            final var key = new CacheKey(flagKey, subject);
            lock.lock();
            try {
                write(key, value);
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void invalidate(String flagKey, String subject) {
            final var key = new CacheKey(flagKey, subject);
            lock.lock();
            try {
                entries.remove(key);
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void clear() {
            lock.lock();
            try {
                entries.clear();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public int cleanupExpired() {
            return locked(TtlFlagCache.this::removeExpired);
        }

        @Override
        public int size() {
            return locked(entries::size);
        }

        @Override
        public Duration ttl() {
            return ttl;
        }

        private <T> T locked(Supplier<T> action) {
            lock.lock();
            try {
                return action.get();
            } finally {
                lock.unlock();
            }
        }
    }

    private class UnlockedView implements FlagCache {

        @Override
        public Optional<Boolean> get(String flagKey, String subject) {
            return read(new CacheKey(flagKey, subject));
        }

        @Override
        public void put(String flagKey, boolean value, String subject) {
            write(new CacheKey(flagKey, subject), value);
        }

        @Override
        public void invalidate(String flagKey, String subject) {
            entries.remove(new CacheKey(flagKey, subject));
        }

        @Override
        public void clear() {
            entries.clear();
        }

        @Override
        public int cleanupExpired() {
            return removeExpired();
        }

        @Override
        public int size() {
            return entries.size();
        }

        @Override
        public Duration ttl() {
            return ttl;
        }
    }
}
