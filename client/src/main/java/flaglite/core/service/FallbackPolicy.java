package flaglite.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import flaglite.core.exception.FlagLiteException;
import flaglite.core.model.EvaluationOutcome;
import flaglite.core.port.out.EvaluationMetrics;

/**
 * The one place where evaluation failures are absorbed.
 *
 * <p>Every failure, classified or not, is logged at WARN and replaced by the
 * caller's fallback value. Nothing is rethrown.
 */
@ApplicationScoped
public class FallbackPolicy {

    private static final Logger LOG = Logger.getLogger(FallbackPolicy.class);

    private final EvaluationMetrics metrics;

    @Inject
    public FallbackPolicy(EvaluationMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Guards an evaluation so that it completes with {@code fallback} instead
     * of failing.
     *
     * @param evaluation the evaluation to guard
     * @param flagKey    flag being evaluated, for logging
     * @param fallback   value to emit on failure
     * @return Uni that never fails
     */
    public Uni<Boolean> guard(Uni<Boolean> evaluation, String flagKey, boolean fallback) {
        return evaluation.onFailure().recoverWithItem(error -> absorb(flagKey, fallback, error));
    }

    /**
     * Logs and records a failure, returning the fallback.
     */
    public boolean absorb(String flagKey, boolean fallback, Throwable error) {
        if (error instanceof FlagLiteException flagLiteError) {
            LOG.warnf("FlagLite error evaluating '%s': %s", flagKey, flagLiteError.getMessage());
        } else {
            LOG.warnf("Unexpected error evaluating flag '%s': %s", flagKey, error);
        }
        metrics.recordError(error.getClass().getSimpleName());
        metrics.recordEvaluation(EvaluationOutcome.FALLBACK);
        return fallback;
    }
}
