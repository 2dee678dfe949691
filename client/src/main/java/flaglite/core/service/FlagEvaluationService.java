package flaglite.core.service;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import flaglite.core.cache.FlagCache;
import flaglite.core.cache.TtlFlagCache;
import flaglite.core.config.ClientSettings;
import flaglite.core.model.EvaluationOutcome;
import flaglite.core.model.FlagLookupResponse;
import flaglite.core.port.in.FlagEvaluationUseCase;
import flaglite.core.port.out.EvaluationMetrics;
import flaglite.core.port.out.FlagLookupClient;

/**
 * Cache-aside flag evaluation.
 *
 * <p>
 * Per call: check the cache, on a miss look the flag up remotely, interpret the
 * response, cache the decision, and on any failure return the caller's
 * fallback. There is no retry and no request coalescing: two concurrent
 * evaluations of the same uncached key may both go remote, and the later cache
 * write replaces the earlier one.
 *
 * <p>
 * The algorithm is written once, as a {@link Uni} pipeline over a
 * {@link RemoteFetch}. The reactive path supplies the non-blocking transport and
 * the locking cache view. The blocking path supplies a fetch that runs the
 * blocking transport synchronously, uses the lock-free cache view, and awaits
 * the pipeline on the calling thread.
 */
@ApplicationScoped
public class FlagEvaluationService implements FlagEvaluationUseCase {

    private static final Logger LOG = Logger.getLogger(FlagEvaluationService.class);

    private final FlagLookupClient lookupClient;
    private final Optional<TtlFlagCache> cache;
    private final ResponseInterpreter interpreter;
    private final FallbackPolicy fallbackPolicy;
    private final EvaluationMetrics metrics;

    @Inject
    public FlagEvaluationService(
            FlagLookupClient lookupClient,
            ClientSettings settings,
            ResponseInterpreter interpreter,
            FallbackPolicy fallbackPolicy,
            EvaluationMetrics metrics) {
        this(
                lookupClient,
                settings.cachingEnabled() ? new TtlFlagCache(settings.cacheTtl()) : null,
                interpreter,
                fallbackPolicy,
                metrics);
    }

    /**
     * Create a service around an existing cache.
     *
     * @param cache decision cache, or {@code null} to disable caching
     */
    public FlagEvaluationService(
            FlagLookupClient lookupClient,
            TtlFlagCache cache,
            ResponseInterpreter interpreter,
            FallbackPolicy fallbackPolicy,
            EvaluationMetrics metrics) {
        this.lookupClient = lookupClient;
        this.cache = Optional.ofNullable(cache);
        this.interpreter = interpreter;
        this.fallbackPolicy = fallbackPolicy;
        this.metrics = metrics;
    }

    @Override
    public Uni<Boolean> evaluate(String flagKey, String subject, boolean fallback) {
        return evaluate(cache.map(TtlFlagCache::concurrent), lookupClient::fetchFlag, flagKey, subject, fallback);
    }

    @Override
    public boolean evaluateBlocking(String flagKey, String subject, boolean fallback) {
        if (!Infrastructure.canCallerThreadBeBlocked()) {
            return fallbackPolicy.absorb(
                    flagKey,
                    fallback,
                    new IllegalStateException("Blocking flag evaluation called on a thread that cannot block"));
        }

        final RemoteFetch blockingFetch =
                (key, subj) -> Uni.createFrom().item(() -> lookupClient.fetchFlagBlocking(key, subj));

        return evaluate(cache.map(TtlFlagCache::singleThreaded), blockingFetch, flagKey, subject, fallback)
                .await()
                .indefinitely();
    }

    private Uni<Boolean> evaluate(
            Optional<FlagCache> view, RemoteFetch fetch, String flagKey, String subject, boolean fallback) {
        final Uni<Boolean> evaluation = Uni.createFrom().deferred(() -> {
            if (view.isPresent()) {
                final var cached = view.get().get(flagKey, subject);
                if (cached.isPresent()) {
                    LOG.debugf("Cache hit for flag '%s' (subject=%s)", flagKey, subject);
                    metrics.recordCacheHit();
                    metrics.recordEvaluation(EvaluationOutcome.CACHE_HIT);
                    return Uni.createFrom().item(cached.get());
                }
                metrics.recordCacheMiss();
                // a stale entry may have been dropped by the read
                metrics.updateCacheSize(view.get().size());
            }

            LOG.debugf("Looking up flag '%s' (subject=%s)", flagKey, subject);
            return fetch.fetch(flagKey, subject).map(interpreter::interpret).map(decision -> {
                view.ifPresent(c -> {
                    c.put(flagKey, decision.enabled(), subject);
                    metrics.updateCacheSize(c.size());
                });
                metrics.recordEvaluation(decision.outcome());
                return decision.enabled();
            });
        });

        return fallbackPolicy.guard(evaluation, flagKey, fallback);
    }

    @Override
    public void invalidate(String flagKey, String subject) {
        cache.ifPresent(c -> {
            c.concurrent().invalidate(flagKey, subject);
            metrics.updateCacheSize(c.concurrent().size());
        });
    }

    @Override
    public void clear() {
        cache.ifPresent(c -> {
            c.concurrent().clear();
            metrics.updateCacheSize(0);
        });
    }

    @Override
    public int cleanupExpired() {
        if (cache.isEmpty()) {
            return 0;
        }
        final var view = cache.get().concurrent();
        final var removed = view.cleanupExpired();
        if (removed > 0) {
            LOG.debugf("Removed %d expired flag decisions", removed);
        }
        metrics.updateCacheSize(view.size());
        return removed;
    }

    @Override
    public Duration cacheTtl() {
        return cache.map(TtlFlagCache::ttl).orElse(Duration.ZERO);
    }

    /**
     * Remote lookup capability supplied by each call path.
     */
    @FunctionalInterface
    interface RemoteFetch {
        Uni<FlagLookupResponse> fetch(String flagKey, String subject);
    }
}
