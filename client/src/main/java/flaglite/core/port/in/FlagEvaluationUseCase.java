package flaglite.core.port.in;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

/**
 * Port for evaluating feature flags.
 *
 * <p>Both evaluation paths run the same algorithm: cache lookup, remote lookup
 * on a miss, cache population, and fallback on any failure. Neither ever fails;
 * on error the caller's fallback value is returned.
 */
public interface FlagEvaluationUseCase {

    /**
     * Evaluates a flag without blocking.
     *
     * @param flagKey  the flag key
     * @param subject  optional subject identifier, may be {@code null}
     * @param fallback value returned if the flag cannot be evaluated
     * @return Uni with the decision; never fails
     */
    Uni<Boolean> evaluate(String flagKey, String subject, boolean fallback);

    /**
     * Evaluates a flag on the calling thread.
     *
     * <p>Uses the lock-free cache view, so callers must not run blocking
     * evaluations concurrently with each other or with reactive ones against
     * the same client.
     *
     * @param flagKey  the flag key
     * @param subject  optional subject identifier, may be {@code null}
     * @param fallback value returned if the flag cannot be evaluated
     * @return the decision
     */
    boolean evaluateBlocking(String flagKey, String subject, boolean fallback);

    /**
     * Drops the cached decision for one (flag key, subject) pair.
     */
    void invalidate(String flagKey, String subject);

    /**
     * Drops every cached decision.
     */
    void clear();

    /**
     * Removes expired cache entries.
     *
     * @return number of entries removed, 0 if caching is disabled
     */
    int cleanupExpired();

    /**
     * @return cache TTL, {@link Duration#ZERO} if caching is disabled
     */
    Duration cacheTtl();
}
