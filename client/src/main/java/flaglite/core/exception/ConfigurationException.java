package flaglite.core.exception;

/**
 * Thrown when the client cannot be built from its configuration, most often
 * because no API key could be resolved.
 *
 * <p>Unlike the other FlagLite errors this one is never absorbed into a
 * fallback decision.
 */
public class ConfigurationException extends FlagLiteException {

    public ConfigurationException(String message) {
        super(message);
    }
}
