package flaglite.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the FlagLite client.
 *
 * <p>Configuration prefix: {@code flaglite}
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code flaglite.api-key} - Environment API key (required)</li>
 *   <li>{@code flaglite.base-url} - Flag service base URL</li>
 *   <li>{@code flaglite.timeout} - HTTP request timeout</li>
 *   <li>{@code flaglite.cache.enabled} - Whether decisions are cached</li>
 *   <li>{@code flaglite.cache.ttl} - How long cached decisions stay fresh</li>
 *   <li>{@code flaglite.metrics.enabled} - Whether Micrometer meters are recorded</li>
 * </ul>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code FLAGLITE_API_KEY} - e.g., "ffl_env_..."</li>
 *   <li>{@code FLAGLITE_BASE_URL} - e.g., "https://api.flaglite.dev/v1"</li>
 *   <li>{@code FLAGLITE_CACHE_TTL} - e.g., "PT30S" for 30 seconds, "PT0S" to disable caching</li>
 * </ul>
 */
@ConfigMapping(prefix = "flaglite")
public interface FlagLiteConfig {

    /**
     * API key sent as a bearer token with every flag lookup.
     *
     * @return API key, empty if not configured
     */
    Optional<String> apiKey();

    /**
     * Base URL of the flag service.
     *
     * @return base URL (default: https://api.flaglite.dev/v1)
     */
    @WithDefault("https://api.flaglite.dev/v1")
    String baseUrl();

    /**
     * Maximum time a single flag lookup may take before it counts as a
     * network failure.
     *
     * @return request timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration timeout();

    /**
     * User-Agent header sent with flag lookups.
     *
     * @return user agent (default: flaglite-java/1.0.0)
     */
    @WithDefault("flaglite-java/1.0.0")
    String userAgent();

    /**
     * Decision cache configuration.
     */
    CacheConfig cache();

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    /**
     * Decision cache settings.
     */
    interface CacheConfig {

        /**
         * Whether decisions are cached at all.
         *
         * @return true to cache (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * How long a cached decision is served before the flag service is
         * asked again. Zero disables caching.
         *
         * @return TTL duration (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration ttl();
    }

    /**
     * Metrics settings.
     */
    interface MetricsConfig {

        /**
         * @return true to record evaluation metrics (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
