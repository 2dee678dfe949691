package flaglite.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("TtlFlagCache")
class TtlFlagCacheTest {

    private static final Duration TTL = Duration.ofSeconds(1);

    private final AtomicLong now = new AtomicLong(1_000L);

    private TtlFlagCache cacheWithFakeClock() {
        return new TtlFlagCache(TTL, now::get);
    }

    private void advance(Duration duration) {
        now.addAndGet(duration.toNanos());
    }

    static Stream<Arguments> views() {
        return Stream.of(
                Arguments.of("concurrent", (Function<TtlFlagCache, FlagCache>) TtlFlagCache::concurrent),
                Arguments.of("single-threaded", (Function<TtlFlagCache, FlagCache>) TtlFlagCache::singleThreaded));
    }

    @Nested
    @DisplayName("Basic Operations")
    class BasicOperations {

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should return a value put within the TTL")
        void shouldPutAndGet(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(cacheWithFakeClock());

            cache.put("flag-1", true);

            assertEquals(Optional.of(true), cache.get("flag-1"));
        }

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should return empty before any put")
        void shouldReturnEmptyForMissingKey(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(cacheWithFakeClock());

            assertTrue(cache.get("nonexistent").isEmpty());
            assertTrue(cache.get("nonexistent", "user-1").isEmpty());
        }

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should cache false decisions")
        void shouldCacheFalse(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(cacheWithFakeClock());

            cache.put("flag-false", false);

            assertEquals(Optional.of(false), cache.get("flag-false"));
        }

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should replace value on re-put")
        void shouldReplaceOnReput(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(cacheWithFakeClock());
            cache.put("flag-1", true);

            cache.put("flag-1", false);

            assertEquals(Optional.of(false), cache.get("flag-1"));
            assertEquals(1, cache.size());
        }

        @Test
        @DisplayName("should report configured TTL from both views")
        void shouldReportTtl() {
            var cache = cacheWithFakeClock();

            assertEquals(TTL, cache.ttl());
            assertEquals(TTL, cache.concurrent().ttl());
            assertEquals(TTL, cache.singleThreaded().ttl());
        }

        @Test
        @DisplayName("should reject negative TTL")
        void shouldRejectNegativeTtl() {
            assertThrows(IllegalArgumentException.class, () -> new TtlFlagCache(Duration.ofSeconds(-1)));
        }

        @Test
        @DisplayName("should share storage between views")
        void shouldShareStorageBetweenViews() {
            var cache = cacheWithFakeClock();

            cache.singleThreaded().put("flag-1", true, "user-1");

            assertEquals(Optional.of(true), cache.concurrent().get("flag-1", "user-1"));
        }
    }

    @Nested
    @DisplayName("Subjects")
    class Subjects {

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should keep entries for different subjects independent")
        void shouldSeparateSubjects(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(cacheWithFakeClock());

            cache.put("flag-1", true, "user-1");
            cache.put("flag-1", false, "user-2");
            cache.put("flag-1", true);

            assertEquals(Optional.of(true), cache.get("flag-1", "user-1"));
            assertEquals(Optional.of(false), cache.get("flag-1", "user-2"));
            assertEquals(Optional.of(true), cache.get("flag-1"));
            assertEquals(3, cache.size());
        }

        @Test
        @DisplayName("should not treat a missing subject as a wildcard")
        void shouldNotTreatNullSubjectAsWildcard() {
            var cache = cacheWithFakeClock().concurrent();

            cache.put("flag-1", true);

            assertTrue(cache.get("flag-1", "user-1").isEmpty());
        }

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should invalidate only the exact subject")
        void shouldInvalidateExactSubject(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(cacheWithFakeClock());
            cache.put("flag-1", true, "user-1");
            cache.put("flag-1", true, "user-2");
            cache.put("flag-1", true);

            cache.invalidate("flag-1", "user-1");

            assertTrue(cache.get("flag-1", "user-1").isEmpty());
            assertEquals(Optional.of(true), cache.get("flag-1", "user-2"));
            assertEquals(Optional.of(true), cache.get("flag-1"));
        }

        @Test
        @DisplayName("should be a no-op to invalidate a missing key")
        void shouldIgnoreInvalidateOfMissingKey() {
            var cache = cacheWithFakeClock().concurrent();
            cache.put("flag-1", true);

            cache.invalidate("flag-2");

            assertEquals(1, cache.size());
        }
    }

    @Nested
    @DisplayName("Clear")
    class Clear {

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should remove all entries regardless of subject")
        void shouldClearAll(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(cacheWithFakeClock());
            cache.put("flag-1", true);
            cache.put("flag-2", true, "user-1");
            cache.put("flag-3", false);

            cache.clear();

            assertTrue(cache.get("flag-1").isEmpty());
            assertTrue(cache.get("flag-2", "user-1").isEmpty());
            assertTrue(cache.get("flag-3").isEmpty());
            assertEquals(0, cache.size());
        }
    }

    @Nested
    @DisplayName("TTL Expiration")
    class TtlExpiration {

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should keep entry live exactly at its expiry instant")
        void shouldBeLiveAtExpiryInstant(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(cacheWithFakeClock());
            cache.put("flag-1", true);

            advance(TTL);

            assertEquals(Optional.of(true), cache.get("flag-1"));
        }

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should miss and remove an expired entry on read")
        void shouldExpireLazilyOnRead(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(cacheWithFakeClock());
            cache.put("flag-1", true);

            advance(TTL.plusNanos(1));

            assertTrue(cache.get("flag-1").isEmpty());
            assertEquals(0, cache.size());
            assertEquals(0, cache.cleanupExpired());
        }

        @Test
        @DisplayName("should refresh expiry when an entry is replaced")
        void shouldRefreshExpiryOnReplace() {
            var cache = cacheWithFakeClock().concurrent();
            cache.put("flag-1", true);
            advance(Duration.ofMillis(800));

            cache.put("flag-1", true);
            advance(Duration.ofMillis(800));

            assertEquals(Optional.of(true), cache.get("flag-1"));
        }

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should keep entries with the longest representable TTL")
        void shouldKeepEntriesWithMaximalTtl(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(new TtlFlagCache(Duration.ofNanos(Long.MAX_VALUE), now::get));
            cache.put("flag-1", true);

            advance(Duration.ofDays(3650));

            assertEquals(Optional.of(true), cache.get("flag-1"));
            assertEquals(0, cache.cleanupExpired());
        }

        @Test
        @DisplayName("should accept a TTL too long to count in nanoseconds")
        void shouldAcceptTtlBeyondNanosecondRange() {
            var cache = new TtlFlagCache(Duration.ofDays(365_000), now::get).concurrent();
            cache.put("flag-1", false);

            advance(Duration.ofDays(3650));

            assertEquals(Optional.of(false), cache.get("flag-1"));
            assertEquals(Duration.ofDays(365_000), cache.ttl());
        }

        @Test
        @DisplayName("should expire entries on the system ticker")
        void shouldExpireWithRealClock() throws InterruptedException {
            var cache = new TtlFlagCache(Duration.ofMillis(100)).concurrent();
            cache.put("expiring", true);

            assertEquals(Optional.of(true), cache.get("expiring"));

            Thread.sleep(150);

            assertTrue(cache.get("expiring").isEmpty());
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class Cleanup {

        @ParameterizedTest(name = "{0} view")
        @MethodSource("flaglite.core.cache.TtlFlagCacheTest#views")
        @DisplayName("should remove only expired entries and report the count")
        void shouldCleanupExpired(String name, Function<TtlFlagCache, FlagCache> viewOf) {
            var cache = viewOf.apply(cacheWithFakeClock());
            cache.put("short", true);
            cache.put("short", false, "user-1");
            advance(TTL.plusMillis(500));
            cache.put("long", true);

            var removed = cache.cleanupExpired();

            assertEquals(2, removed);
            assertTrue(cache.get("short").isEmpty());
            assertEquals(Optional.of(true), cache.get("long"));
        }

        @Test
        @DisplayName("should return zero on an empty cache")
        void shouldReturnZeroWhenEmpty() {
            assertEquals(0, cacheWithFakeClock().concurrent().cleanupExpired());
        }

        @Test
        @DisplayName("should clean up with the system ticker")
        void shouldCleanupWithRealClock() throws InterruptedException {
            var cache = new TtlFlagCache(Duration.ofMillis(100)).concurrent();
            cache.put("short", true);
            Thread.sleep(150);
            cache.put("long", true);

            assertEquals(1, cache.cleanupExpired());
            assertTrue(cache.get("short").isEmpty());
            assertEquals(Optional.of(true), cache.get("long"));
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("should hold a single entry per key under concurrent writers")
        void shouldKeepOneEntryPerKeyUnderConcurrentWrites() throws InterruptedException {
            var cache = new TtlFlagCache(Duration.ofMinutes(1)).concurrent();
            var executor = Executors.newFixedThreadPool(8);
            var start = new CountDownLatch(1);
            var done = new CountDownLatch(8);

            for (int i = 0; i < 8; i++) {
                final var value = i % 2 == 0;
                executor.submit(() -> {
                    try {
                        start.await();
                        for (int j = 0; j < 500; j++) {
                            cache.put("shared", value, "user-1");
                            cache.get("shared", "user-1");
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertTrue(done.await(10, TimeUnit.SECONDS));
            executor.shutdownNow();

            assertEquals(1, cache.size());
            assertFalse(cache.get("shared", "user-1").isEmpty());
        }
    }
}
