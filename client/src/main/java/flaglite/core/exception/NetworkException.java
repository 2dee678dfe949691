package flaglite.core.exception;

/**
 * Thrown when the flag service could not be reached: timeouts, refused
 * connections and other transport failures.
 */
public class NetworkException extends FlagLiteException {

    public NetworkException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
