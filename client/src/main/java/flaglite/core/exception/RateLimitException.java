package flaglite.core.exception;

import java.util.OptionalInt;

/**
 * Thrown when the flag service throttles the client.
 */
public class RateLimitException extends FlagLiteException {

    public static final int STATUS_CODE = 429;

    private final Integer retryAfterSeconds;

    public RateLimitException(String message, Integer retryAfterSeconds) {
        super(message, STATUS_CODE);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * Seconds to wait before retrying, from the {@code Retry-After} header.
     */
    public OptionalInt retryAfterSeconds() {
        return retryAfterSeconds != null ? OptionalInt.of(retryAfterSeconds) : OptionalInt.empty();
    }
}
