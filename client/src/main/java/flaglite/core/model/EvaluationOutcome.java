package flaglite.core.model;

/**
 * How an evaluation arrived at its result.
 */
public enum EvaluationOutcome {
    CACHE_HIT,
    REMOTE,
    NOT_FOUND,
    FALLBACK
}
