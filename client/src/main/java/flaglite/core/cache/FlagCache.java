package flaglite.core.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Time-bounded cache of flag decisions keyed by (flag key, subject).
 *
 * <p>Entries expire lazily: a read that finds a stale entry reports a miss and
 * removes it. {@link #cleanupExpired()} reclaims stale entries that are never
 * read again.
 */
public interface FlagCache {

    /**
     * Gets a cached decision.
     *
     * @param flagKey the feature flag key
     * @param subject optional subject identifier, may be {@code null}
     * @return the decision if present and not expired
     */
    Optional<Boolean> get(String flagKey, String subject);

    /**
     * Stores a decision, replacing any existing entry for the same key.
     *
     * <p>The entry expires after the configured TTL.
     *
     * @param flagKey the feature flag key
     * @param value   the decision
     * @param subject optional subject identifier, may be {@code null}
     */
    void put(String flagKey, boolean value, String subject);

    /**
     * Removes the entry for exactly this (flag key, subject) pair.
     *
     * @param flagKey the feature flag key
     * @param subject optional subject identifier, may be {@code null}
     */
    void invalidate(String flagKey, String subject);

    /**
     * Removes all entries.
     */
    void clear();

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    int cleanupExpired();

    /**
     * Returns the number of entries held, including expired ones not yet removed.
     */
    int size();

    /**
     * Returns the time-to-live applied to new entries.
     */
    Duration ttl();

    default Optional<Boolean> get(String flagKey) {
        return get(flagKey, null);
    }

    default void put(String flagKey, boolean value) {
        put(flagKey, value, null);
    }

    default void invalidate(String flagKey) {
        invalidate(flagKey, null);
    }
}
