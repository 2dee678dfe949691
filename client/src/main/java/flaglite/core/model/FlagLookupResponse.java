package flaglite.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Raw outcome of one flag lookup against the flag service.
 *
 * <p>Header names are matched case-insensitively.
 *
 * @param statusCode HTTP status code
 * @param body       response body, empty if the response had none
 * @param headers    response headers, first value per name
 */
public record FlagLookupResponse(int statusCode, Optional<String> body, Map<String, String> headers) {

    public FlagLookupResponse {
        body = body != null ? body : Optional.empty();
        final var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
    }

    public static FlagLookupResponse of(int statusCode, String body) {
        return new FlagLookupResponse(statusCode, Optional.ofNullable(body), Map.of());
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }
}
