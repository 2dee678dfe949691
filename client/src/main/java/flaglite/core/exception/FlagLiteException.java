package flaglite.core.exception;

import java.util.OptionalInt;

/**
 * Base exception for FlagLite client errors.
 *
 * <p>Carries the HTTP status code of the response that caused it, when there
 * was one.
 */
public class FlagLiteException extends RuntimeException {

    private final Integer statusCode;

    public FlagLiteException(String message) {
        this(message, null, null);
    }

    public FlagLiteException(String message, Integer statusCode) {
        this(message, statusCode, null);
    }

    public FlagLiteException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status code of the failed response, empty for transport and
     * configuration errors.
     */
    public OptionalInt statusCode() {
        return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }
}
