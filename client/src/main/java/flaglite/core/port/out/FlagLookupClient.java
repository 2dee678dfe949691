package flaglite.core.port.out;

import io.smallrye.mutiny.Uni;

import flaglite.core.model.FlagLookupResponse;

/**
 * Port for looking up a flag at the remote flag service.
 *
 * <p>Implementations return every HTTP response as a {@link FlagLookupResponse},
 * whatever its status; interpreting the status is the caller's job. Transport
 * failures (timeouts, refused connections) are reported as
 * {@link flaglite.core.exception.NetworkException}.
 *
 * <p>Implementations own one transport handle per call path and release both
 * in {@link #close()}.
 */
public interface FlagLookupClient extends AutoCloseable {

    /**
     * Looks up a flag without blocking the caller.
     *
     * @param flagKey the flag key
     * @param subject optional subject identifier, may be {@code null}
     * @return Uni with the response, failing with NetworkException on transport failure
     */
    Uni<FlagLookupResponse> fetchFlag(String flagKey, String subject);

    /**
     * Looks up a flag, blocking the calling thread until the response arrives
     * or the request times out. Must not be called on an event loop thread.
     *
     * @param flagKey the flag key
     * @param subject optional subject identifier, may be {@code null}
     * @return the response
     * @throws flaglite.core.exception.NetworkException on transport failure
     */
    FlagLookupResponse fetchFlagBlocking(String flagKey, String subject);

    /**
     * Releases both transport handles. Safe to call more than once.
     */
    @Override
    void close();
}
