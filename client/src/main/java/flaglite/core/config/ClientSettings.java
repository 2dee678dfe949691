package flaglite.core.config;

import java.time.Duration;

import flaglite.core.exception.ConfigurationException;

/**
 * Validated, resolved client settings.
 *
 * <p>Built once per client. Construction fails with a
 * {@link ConfigurationException} when no API key is available, since a client
 * without a credential cannot produce any decision.
 *
 * @param apiKey         API key sent as bearer token
 * @param baseUrl        flag service base URL, always ending in {@code /}
 * @param timeout        per-request timeout
 * @param userAgent      User-Agent header value
 * @param cacheTtl       decision cache TTL, {@link Duration#ZERO} when caching is disabled
 * @param metricsEnabled whether evaluation metrics are recorded
 */
public record ClientSettings(
        String apiKey,
        String baseUrl,
        Duration timeout,
        String userAgent,
        Duration cacheTtl,
        boolean metricsEnabled) {

    public static final String DEFAULT_BASE_URL = "https://api.flaglite.dev/v1";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "flaglite-java/1.0.0";

    public ClientSettings {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("API key required. Pass an API key, or set flaglite.api-key"
                    + " or the FLAGLITE_API_KEY environment variable.");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        if (!baseUrl.endsWith("/")) {
            baseUrl = baseUrl + "/";
        }
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (userAgent == null || userAgent.isBlank()) {
            userAgent = DEFAULT_USER_AGENT;
        }
        if (cacheTtl == null) {
            cacheTtl = DEFAULT_CACHE_TTL;
        }
        if (cacheTtl.isNegative()) {
            throw new ConfigurationException("Cache TTL must not be negative, got: " + cacheTtl);
        }
    }

    /**
     * Settings with defaults for everything but the API key.
     *
     * @param apiKey the API key
     * @return settings using the default base URL, timeout and cache TTL
     */
    public static ClientSettings withApiKey(String apiKey) {
        return new ClientSettings(apiKey, DEFAULT_BASE_URL, DEFAULT_TIMEOUT, DEFAULT_USER_AGENT, DEFAULT_CACHE_TTL, true);
    }

    public ClientSettings withBaseUrl(String url) {
        return new ClientSettings(apiKey, url, timeout, userAgent, cacheTtl, metricsEnabled);
    }

    public ClientSettings withTimeout(Duration requestTimeout) {
        return new ClientSettings(apiKey, baseUrl, requestTimeout, userAgent, cacheTtl, metricsEnabled);
    }

    /**
     * @param ttl decision cache TTL, {@link Duration#ZERO} disables caching
     */
    public ClientSettings withCacheTtl(Duration ttl) {
        return new ClientSettings(apiKey, baseUrl, timeout, userAgent, ttl, metricsEnabled);
    }

    public ClientSettings withoutCache() {
        return withCacheTtl(Duration.ZERO);
    }

    public boolean cachingEnabled() {
        return !cacheTtl.isZero();
    }

    @Override
    public String toString() {
        // apiKey is never rendered
        return "ClientSettings[baseUrl=" + baseUrl + ", timeout=" + timeout + ", userAgent=" + userAgent
                + ", cacheTtl=" + cacheTtl + ", metricsEnabled=" + metricsEnabled + "]";
    }
}
