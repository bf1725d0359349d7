package scanagram.core.model.governor;

/**
 * Outcome of a single remote call, as reported by the API client.
 *
 * <p>The governor looks at nothing but this three-way classification.
 *
 * @param <T> the response type
 */
public sealed interface CallOutcome<T> {

    /**
     * The call returned a usable response.
     *
     * @param value the response
     */
    record Success<T>(T value) implements CallOutcome<T> {}

    /**
     * The call failed in a way that may succeed on retry.
     *
     * @param category the failure category (always transient)
     * @param message  description of the failure
     */
    record TransientFailure<T>(FailureCategory category, String message) implements CallOutcome<T> {}

    /**
     * The call failed in a way retrying cannot fix.
     *
     * @param category the failure category
     * @param message  description of the failure
     */
    record FatalFailure<T>(FailureCategory category, String message) implements CallOutcome<T> {}

    static <T> CallOutcome<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * Create a failure outcome whose kind follows the category.
     *
     * @param category the failure category
     * @param message  description of the failure
     * @return a transient failure for transient categories, a fatal one otherwise
     */
    static <T> CallOutcome<T> failure(FailureCategory category, String message) {
        if (category.isTransient()) {
            return new TransientFailure<>(category, message);
        }
        return new FatalFailure<>(category, message);
    }
}
