package flaglite.core.cache;

import java.util.Objects;

/**
 * Identity of a cached flag decision.
 *
 * <p>A {@code null} subject is its own partition: a decision cached without a
 * subject never answers a lookup for a concrete subject, and vice versa.
 *
 * @param flagKey the feature flag key
 * @param subject optional subject (user) identifier, may be {@code null}
 */
public record CacheKey(String flagKey, String subject) {

    public CacheKey {
        Objects.requireNonNull(flagKey, "flagKey must not be null");
    }
}
