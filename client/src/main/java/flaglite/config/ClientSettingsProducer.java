package flaglite.config;

import java.time.Duration;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import flaglite.core.config.ClientSettings;

/**
 * Produces validated {@link ClientSettings} for injection into core services.
 * This bridges the SmallRye {@link FlagLiteConfig} mapping to the core layer.
 *
 * <p>Outside of CDI, {@link #fromEnvironment()} resolves the same mapping from
 * system properties and environment variables, e.g. {@code FLAGLITE_API_KEY}
 * and {@code FLAGLITE_BASE_URL}.
 */
@ApplicationScoped
public class ClientSettingsProducer {

    // Above system properties (400) and environment variables (300)
    private static final int OVERRIDE_ORDINAL = 500;

    private final FlagLiteConfig config;

    @Inject
    public ClientSettingsProducer(FlagLiteConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public ClientSettings clientSettings() {
        return toSettings(config);
    }

    /**
     * Resolve settings without a container, from system properties and
     * environment variables.
     *
     * @return validated settings
     * @throws flaglite.core.exception.ConfigurationException if no API key is configured
     */
    public static ClientSettings fromEnvironment() {
        return fromEnvironment(Map.of());
    }

    static ClientSettings fromEnvironment(Map<String, String> overrides) {
        final SmallRyeConfig smallRyeConfig = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "flaglite-overrides", OVERRIDE_ORDINAL))
                .withMapping(FlagLiteConfig.class)
                .build();
        return toSettings(smallRyeConfig.getConfigMapping(FlagLiteConfig.class));
    }

    static ClientSettings toSettings(FlagLiteConfig config) {
        final var cacheTtl = config.cache().enabled() ? config.cache().ttl() : Duration.ZERO;
        return new ClientSettings(
                config.apiKey().orElse(null),
                config.baseUrl(),
                config.timeout(),
                config.userAgent(),
                cacheTtl,
                config.metrics().enabled());
    }
}
