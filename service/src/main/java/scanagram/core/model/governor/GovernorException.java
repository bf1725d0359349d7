package scanagram.core.model.governor;

/**
 * Thrown when a governed operation ends in a terminal failure and the caller
 * asked for the response anyway.
 */
public class GovernorException extends RuntimeException {

    private final transient GovernorResult<?> result;

    public GovernorException(GovernorResult<?> result) {
        super(describe(result));
        this.result = result;
    }

    protected GovernorException(String message, GovernorResult<?> result) {
        super(message);
        this.result = result;
    }

    public GovernorResult<?> result() {
        return result;
    }

    /**
     * Category of the failure that ended the operation.
     *
     * @return the category, or {@code null} for a successful result
     */
    public FailureCategory category() {
        if (result instanceof GovernorResult.FatalFailure<?> fatal) {
            return fatal.category();
        }
        if (result instanceof GovernorResult.RetriesExhausted<?> exhausted) {
            return exhausted.lastCategory();
        }
        return null;
    }

    public boolean isRetriesExhausted() {
        return result instanceof GovernorResult.RetriesExhausted<?>;
    }

    protected static String describe(GovernorResult<?> result) {
        if (result instanceof GovernorResult.FatalFailure<?> fatal) {
            return "Call failed (%s) after %d attempt(s): %s"
                    .formatted(fatal.category(), fatal.attempts(), fatal.message());
        }
        if (result instanceof GovernorResult.RetriesExhausted<?> exhausted) {
            return "Retries exhausted after %d attempt(s), last failure (%s): %s"
                    .formatted(exhausted.attempts(), exhausted.lastCategory(), exhausted.lastMessage());
        }
        return "Call did not fail";
    }
}
