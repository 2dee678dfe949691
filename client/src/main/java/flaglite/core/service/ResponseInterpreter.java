package flaglite.core.service;

import jakarta.enterprise.context.ApplicationScoped;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import flaglite.core.exception.AuthenticationException;
import flaglite.core.exception.FlagLiteException;
import flaglite.core.exception.RateLimitException;
import flaglite.core.model.FlagDecision;
import flaglite.core.model.FlagLookupResponse;

/**
 * Turns a flag service response into a decision or a classified failure.
 *
 * <h2>Status codes</h2>
 * <ul>
 *   <li>200 - decision from the truthiness of the body's {@code enabled} field, false if absent</li>
 *   <li>401 - {@link AuthenticationException}</li>
 *   <li>404 - unknown flag, decision false</li>
 *   <li>429 - {@link RateLimitException} with the {@code Retry-After} hint</li>
 *   <li>anything else - {@link FlagLiteException} with the body's {@code message}</li>
 * </ul>
 */
@ApplicationScoped
public class ResponseInterpreter {

    static final String ENABLED_FIELD = "enabled";
    static final String MESSAGE_FIELD = "message";
    static final String RETRY_AFTER_HEADER = "Retry-After";

    public FlagDecision interpret(FlagLookupResponse response) {
        final var status = response.statusCode();

        if (status == 200) {
            return FlagDecision.remote(readEnabled(response));
        }
        if (status == 401) {
            throw new AuthenticationException("Invalid API key", status);
        }
        if (status == 404) {
            return FlagDecision.notFound();
        }
        if (status == RateLimitException.STATUS_CODE) {
            throw new RateLimitException("Rate limit exceeded", retryAfter(response));
        }

        throw new FlagLiteException(errorMessage(response), status);
    }

    private boolean readEnabled(FlagLookupResponse response) {
        final var body = response.body()
                .filter(b -> !b.isBlank())
                .orElseThrow(() -> new DecodeException("Empty response body"));

        return truthy(new JsonObject(body).getValue(ENABLED_FIELD));
    }

    /**
     * JSON truthiness: null, false, zero and empty strings, arrays or objects
     * are false; everything else is true.
     */
    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof String text) {
            return !text.isEmpty();
        }
        if (value instanceof JsonArray array) {
            return !array.isEmpty();
        }
        if (value instanceof JsonObject object) {
            return !object.isEmpty();
        }
        return true;
    }

    private Integer retryAfter(FlagLookupResponse response) {
        final var header = response.header(RETRY_AFTER_HEADER);
        if (header.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(header.get().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String errorMessage(FlagLookupResponse response) {
        final var fallbackMessage = "HTTP " + response.statusCode();
        if (response.body().isEmpty()) {
            return fallbackMessage;
        }
        try {
            final var message = new JsonObject(response.body().get()).getValue(MESSAGE_FIELD);
            return message != null ? message.toString() : fallbackMessage;
        } catch (RuntimeException e) {
            return fallbackMessage;
        }
    }
}
