package flaglite;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.runtime.Startup;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import flaglite.adapter.out.http.VertxFlagLookupClient;
import flaglite.adapter.out.telemetry.MicrometerEvaluationMetrics;
import flaglite.config.ClientSettingsProducer;
import flaglite.core.config.ClientSettings;
import flaglite.core.port.in.FlagEvaluationUseCase;
import flaglite.core.port.out.FlagLookupClient;
import flaglite.core.service.FallbackPolicy;
import flaglite.core.service.FlagEvaluationService;
import flaglite.core.service.ResponseInterpreter;

/**
 * FlagLite feature flag client.
 *
 * <p>Checks whether flags are enabled, caching decisions for the configured
 * TTL. Evaluation never throws: on any error (network, authentication, rate
 * limiting, malformed responses) the caller's default is returned, which is
 * {@code false} unless specified.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * @Inject
 * FlagLite flags;
 *
 * // Reactive
 * flags.enabled("new-checkout", "user-123").subscribe().with(on -> ...);
 *
 * // Blocking, off the event loop
 * if (flags.enabledBlocking("new-checkout")) {
 *     showNewCheckout();
 * }
 *
 * // Outside a Quarkus application, configured from FLAGLITE_API_KEY
 * try (var client = FlagLite.create()) {
 *     client.enabledBlocking("new-checkout");
 * }
 * }</pre>
 *
 * <p>Blocking evaluations use a lock-free view of the decision cache. Run them
 * from one thread at a time and not concurrently with reactive evaluations on
 * the same client.
 */
@Startup
@ApplicationScoped
public class FlagLite implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(FlagLite.class);

    private final FlagEvaluationUseCase evaluation;
    private final FlagLookupClient lookupClient;
    private final Vertx ownedVertx;
    private final AtomicBoolean vertxClosed = new AtomicBoolean(false);

    @Inject
    public FlagLite(FlagEvaluationUseCase evaluation, FlagLookupClient lookupClient, ClientSettings settings) {
        this(evaluation, lookupClient, settings, null);
    }

    private FlagLite(
            FlagEvaluationUseCase evaluation, FlagLookupClient lookupClient, ClientSettings settings, Vertx ownedVertx) {
        this.evaluation = evaluation;
        this.lookupClient = lookupClient;
        this.ownedVertx = ownedVertx;
        LOG.infof("FlagLite client ready: %s", settings);
    }

    /**
     * Build a client outside of CDI from system properties and environment
     * variables ({@code FLAGLITE_API_KEY}, {@code FLAGLITE_BASE_URL}, ...).
     *
     * @return a new client owning its Vert.x instance
     * @throws flaglite.core.exception.ConfigurationException if no API key is configured
     */
    public static FlagLite create() {
        return create(ClientSettingsProducer.fromEnvironment());
    }

    /**
     * Build a client outside of CDI, with its own Vert.x instance.
     *
     * <p>The Vert.x instance is closed together with the client.
     *
     * @param settings client settings
     * @return a new client
     */
    public static FlagLite create(ClientSettings settings) {
        final var vertx = Vertx.vertx();
        return create(settings, vertx, new SimpleMeterRegistry(), vertx);
    }

    /**
     * Build a client outside of CDI on a caller-owned Vert.x instance.
     *
     * @param settings client settings
     * @param vertx    Vert.x instance, not closed by the client
     * @param registry registry for evaluation metrics
     * @return a new client
     */
    public static FlagLite create(ClientSettings settings, Vertx vertx, MeterRegistry registry) {
        return create(settings, vertx, registry, null);
    }

    private static FlagLite create(ClientSettings settings, Vertx vertx, MeterRegistry registry, Vertx ownedVertx) {
        final var metrics = new MicrometerEvaluationMetrics(registry, settings);
        final var lookupClient = new VertxFlagLookupClient(vertx, settings);
        final var service = new FlagEvaluationService(
                lookupClient, settings, new ResponseInterpreter(), new FallbackPolicy(metrics), metrics);
        return new FlagLite(service, lookupClient, settings, ownedVertx);
    }

    public Uni<Boolean> enabled(String flagKey) {
        return enabled(flagKey, null, false);
    }

    public Uni<Boolean> enabled(String flagKey, String subject) {
        return enabled(flagKey, subject, false);
    }

    /**
     * Check if a feature flag is enabled.
     *
     * @param flagKey       the flag key, e.g. "new-checkout"
     * @param subject       optional subject (user) identifier for consistent
     *                      percentage rollouts, may be {@code null}
     * @param defaultValue  value to emit if the flag cannot be evaluated
     * @return Uni with the decision; never fails
     */
    public Uni<Boolean> enabled(String flagKey, String subject, boolean defaultValue) {
        return evaluation.evaluate(flagKey, subject, defaultValue);
    }

    public boolean enabledBlocking(String flagKey) {
        return enabledBlocking(flagKey, null, false);
    }

    public boolean enabledBlocking(String flagKey, String subject) {
        return enabledBlocking(flagKey, subject, false);
    }

    /**
     * Blocking variant of {@link #enabled(String, String, boolean)}.
     *
     * <p>Must not be called on a Vert.x event loop thread; doing so returns
     * {@code defaultValue}.
     */
    public boolean enabledBlocking(String flagKey, String subject, boolean defaultValue) {
        return evaluation.evaluateBlocking(flagKey, subject, defaultValue);
    }

    public void invalidateCache(String flagKey) {
        invalidateCache(flagKey, null);
    }

    /**
     * Drop the cached decision for a flag and subject, forcing the next
     * evaluation to go remote.
     */
    public void invalidateCache(String flagKey, String subject) {
        evaluation.invalidate(flagKey, subject);
    }

    public void clearCache() {
        evaluation.clear();
    }

    /**
     * Reclaim memory held by expired decisions.
     *
     * @return number of decisions removed
     */
    public int cleanupExpired() {
        return evaluation.cleanupExpired();
    }

    /**
     * @return cache TTL, {@link Duration#ZERO} if caching is disabled
     */
    public Duration cacheTtl() {
        return evaluation.cacheTtl();
    }

    /**
     * Release the client's HTTP connections.
     */
    @PreDestroy
    @Override
    public void close() {
        lookupClient.close();
        if (ownedVertx != null && vertxClosed.compareAndSet(false, true)) {
            ownedVertx.closeAndAwait();
        }
        LOG.debug("FlagLite client closed");
    }
}
