package scanagram.core.model.governor;

/**
 * Terminal result of a governed operation.
 *
 * @param <T> the response type
 */
public sealed interface GovernorResult<T> {

    /**
     * Number of attempts made, the successful or failing one included.
     */
    int attempts();

    GovernorState state();

    /**
     * The operation produced a response.
     *
     * @param value    the response
     * @param attempts attempts made
     */
    record Success<T>(T value, int attempts) implements GovernorResult<T> {
        @Override
        public GovernorState state() {
            return GovernorState.SUCCESS;
        }
    }

    /**
     * The operation failed with a non-retryable error.
     *
     * @param category the failure category
     * @param message  description of the failure
     * @param attempts attempts made
     */
    record FatalFailure<T>(FailureCategory category, String message, int attempts) implements GovernorResult<T> {
        @Override
        public GovernorState state() {
            return GovernorState.FATAL_FAILURE;
        }
    }

    /**
     * Every attempt failed transiently.
     *
     * @param attempts     attempts made, equal to the configured maximum
     * @param lastCategory category of the last failure
     * @param lastMessage  description of the last failure
     */
    record RetriesExhausted<T>(int attempts, FailureCategory lastCategory, String lastMessage)
            implements GovernorResult<T> {
        @Override
        public GovernorState state() {
            return GovernorState.RETRIES_EXHAUSTED;
        }
    }

    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    /**
     * Return the response or throw a {@link GovernorException} describing the failure.
     *
     * @return the response of a successful operation
     * @throws GovernorException when the operation failed
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new GovernorException(this);
    }
}
