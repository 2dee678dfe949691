package flaglite.adapter.out.http;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import flaglite.core.config.ClientSettings;
import flaglite.core.exception.FlagLiteException;
import flaglite.core.exception.NetworkException;
import flaglite.core.model.FlagLookupResponse;
import flaglite.core.port.out.FlagLookupClient;

/**
 * HTTP adapter for flag lookups using Vert.x WebClient.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * GET {base-url}/flags/{flagKey}?user_id={subject}
 * Authorization: Bearer {api-key}
 * Content-Type: application/json
 * }</pre>
 *
 * <p>Two WebClients are kept, each with its own connection pool: one for
 * reactive lookups and one for blocking lookups. Both are created on first use
 * and closed by {@link #close()}; a closed client re-creates them on demand.
 */
@ApplicationScoped
public class VertxFlagLookupClient implements FlagLookupClient {

    private static final Logger LOG = Logger.getLogger(VertxFlagLookupClient.class);

    static final String FLAGS_PATH = "flags/";
    static final String SUBJECT_PARAM = "user_id";

    // Headroom over the request timeout so the transport's own timeout fires first
    private static final Duration AWAIT_MARGIN = Duration.ofSeconds(1);

    private final Vertx vertx;
    private final ClientSettings settings;

    private WebClient reactiveClient;
    private WebClient blockingClient;

    @Inject
    public VertxFlagLookupClient(Vertx vertx, ClientSettings settings) {
        this.vertx = vertx;
        this.settings = settings;
    }

    @Override
    public Uni<FlagLookupResponse> fetchFlag(String flagKey, String subject) {
        return Uni.createFrom().deferred(() -> send(reactiveClient(), flagKey, subject));
    }

    @Override
    public FlagLookupResponse fetchFlagBlocking(String flagKey, String subject) {
        try {
            return send(blockingClient(), flagKey, subject)
                    .await()
                    .atMost(settings.timeout().plus(AWAIT_MARGIN));
        } catch (io.smallrye.mutiny.TimeoutException e) {
            throw new NetworkException("Request timed out: " + e.getMessage(), e);
        }
    }

    private Uni<FlagLookupResponse> send(WebClient client, String flagKey, String subject) {
        final var request = client.getAbs(settings.baseUrl() + FLAGS_PATH + flagKey)
                .timeout(settings.timeout().toMillis())
                .putHeader("Authorization", "Bearer " + settings.apiKey())
                .putHeader("Content-Type", "application/json");

        if (subject != null && !subject.isEmpty()) {
            request.addQueryParam(SUBJECT_PARAM, subject);
        }

        return request.send()
                .map(this::toLookupResponse)
                .onFailure()
                .transform(this::toNetworkException);
    }

    private FlagLookupResponse toLookupResponse(HttpResponse<Buffer> response) {
        final var headers = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        for (var name : response.headers().names()) {
            headers.put(name, response.headers().get(name));
        }

        LOG.debugf("Flag service responded with status %d", response.statusCode());
        return new FlagLookupResponse(response.statusCode(), Optional.ofNullable(response.bodyAsString()), headers);
    }

    private Throwable toNetworkException(Throwable error) {
        if (error instanceof FlagLiteException) {
            return error;
        }
        if (error instanceof TimeoutException) {
            return new NetworkException("Request timed out: " + error.getMessage(), error);
        }
        if (error instanceof IOException) {
            return new NetworkException("Network error: " + error.getMessage(), error);
        }
        return new NetworkException("HTTP error: " + error.getMessage(), error);
    }

    private synchronized WebClient reactiveClient() {
        if (reactiveClient == null) {
            LOG.debugf("Creating reactive flag service client for %s", settings.baseUrl());
            reactiveClient = WebClient.create(vertx, clientOptions());
        }
        return reactiveClient;
    }

    private synchronized WebClient blockingClient() {
        if (blockingClient == null) {
            LOG.debugf("Creating blocking flag service client for %s", settings.baseUrl());
            blockingClient = WebClient.create(vertx, clientOptions());
        }
        return blockingClient;
    }

    private WebClientOptions clientOptions() {
        return new WebClientOptions()
                .setUserAgent(settings.userAgent())
                .setConnectTimeout((int) settings.timeout().toMillis())
                .setKeepAlive(true);
    }

    /**
     * Whether any transport handle is currently open.
     */
    synchronized boolean hasOpenHandles() {
        return reactiveClient != null || blockingClient != null;
    }

    @PreDestroy
    @Override
    public synchronized void close() {
        if (reactiveClient != null) {
            reactiveClient.close();
            reactiveClient = null;
        }
        if (blockingClient != null) {
            blockingClient.close();
            blockingClient = null;
        }
    }
}
