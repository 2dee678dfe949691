package flaglite.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import flaglite.core.config.ClientSettings;
import flaglite.core.model.EvaluationOutcome;
import flaglite.core.port.out.EvaluationMetrics;

/**
 * Micrometer metrics for flag evaluations.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code flaglite.evaluation.total} - Evaluations by outcome</li>
 *   <li>{@code flaglite.cache.hits} - Cache hit count</li>
 *   <li>{@code flaglite.cache.misses} - Cache miss count</li>
 *   <li>{@code flaglite.cache.size} - Current cache size gauge</li>
 *   <li>{@code flaglite.evaluation.errors} - Failures absorbed into a fallback, by type</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerEvaluationMetrics implements EvaluationMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    private final AtomicLong cacheSize = new AtomicLong(0);

    @Inject
    public MicrometerEvaluationMetrics(MeterRegistry registry, ClientSettings settings) {
        this.registry = registry;
        this.enabled = settings.metricsEnabled();

        if (enabled) {
            registerCacheSizeGauge();
        }
    }

    private void registerCacheSizeGauge() {
        Gauge.builder("flaglite.cache.size", cacheSize, AtomicLong::get)
                .description("Current number of entries in the flag decision cache")
                .register(registry);
    }

    /**
     * Check if metrics recording is enabled.
     *
     * @return true if metrics are enabled
     */
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordEvaluation(EvaluationOutcome outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("flaglite.evaluation.total")
                .description("Total flag evaluations")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheHit() {
        if (!enabled) {
            return;
        }

        Counter.builder("flaglite.cache.hits")
                .description("Flag decision cache hits")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheMiss() {
        if (!enabled) {
            return;
        }

        Counter.builder("flaglite.cache.misses")
                .description("Flag decision cache misses")
                .register(registry)
                .increment();
    }

    @Override
    public void updateCacheSize(long size) {
        cacheSize.set(size);
    }

    @Override
    public void recordError(String errorType) {
        if (!enabled) {
            return;
        }

        Counter.builder("flaglite.evaluation.errors")
                .description("Flag evaluation failures answered with the fallback value")
                .tag("type", errorType == null ? "unknown" : errorType)
                .register(registry)
                .increment();
    }
}
