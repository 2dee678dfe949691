package flaglite.core.port.out;

import flaglite.core.model.EvaluationOutcome;

/**
 * Port interface for recording flag evaluation metrics.
 *
 * <p>Keeps the evaluation service decoupled from a specific metrics library.
 */
public interface EvaluationMetrics {

    /**
     * Record a completed evaluation.
     *
     * @param outcome how the result was obtained
     */
    void recordEvaluation(EvaluationOutcome outcome);

    void recordCacheHit();

    void recordCacheMiss();

    /**
     * Update the cache size gauge.
     *
     * @param size entries currently held
     */
    void updateCacheSize(long size);

    /**
     * Record a failure absorbed into a fallback decision.
     *
     * @param errorType simple name of the failure
     */
    void recordError(String errorType);
}
