package flaglite.core.model;

/**
 * A decision produced from a successful flag lookup.
 *
 * @param enabled whether the flag is on for the subject
 * @param outcome {@link EvaluationOutcome#REMOTE} or {@link EvaluationOutcome#NOT_FOUND}
 */
public record FlagDecision(boolean enabled, EvaluationOutcome outcome) {

    public static FlagDecision remote(boolean enabled) {
        return new FlagDecision(enabled, EvaluationOutcome.REMOTE);
    }

    public static FlagDecision notFound() {
        return new FlagDecision(false, EvaluationOutcome.NOT_FOUND);
    }
}
