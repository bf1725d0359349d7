package scanagram.core.model.governor;

/**
 * Classification of a failed remote call.
 *
 * <p>Transient categories are likely to succeed on retry; fatal ones are not.
 */
public enum FailureCategory {
    RATE_LIMITED(true),
    TIMEOUT(true),
    UNAVAILABLE(true),
    NETWORK(true),
    NOT_FOUND(false),
    UNAUTHORIZED(false),
    FORBIDDEN(false),
    INVALID_REQUEST(false),
    UNEXPECTED(false);

    private final boolean transientFailure;

    FailureCategory(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
