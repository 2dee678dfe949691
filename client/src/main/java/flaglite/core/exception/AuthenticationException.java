package flaglite.core.exception;

/**
 * Thrown when the flag service rejects the API key.
 */
public class AuthenticationException extends FlagLiteException {

    public AuthenticationException(String message, Integer statusCode) {
        super(message, statusCode);
    }
}
