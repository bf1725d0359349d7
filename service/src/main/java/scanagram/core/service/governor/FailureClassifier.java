package scanagram.core.service.governor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import scanagram.core.model.governor.CallOutcome;
import scanagram.core.model.governor.FailureCategory;

/**
 * Turns exceptions escaping a remote call into call outcomes.
 *
 * <p>Timeouts and I/O errors are transient. Anything else is treated as a
 * programming or protocol error and is fatal.
 */
public class FailureClassifier {

    public FailureCategory categorize(Throwable failure) {
        final var cause = unwrap(failure);
        if (cause instanceof TimeoutException) {
            return FailureCategory.TIMEOUT;
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return FailureCategory.NETWORK;
        }
        return FailureCategory.UNEXPECTED;
    }

    public <T> CallOutcome<T> toOutcome(Throwable failure) {
        final var cause = unwrap(failure);
        final var message = cause.getMessage() != null
                ? cause.getMessage()
                : cause.getClass().getSimpleName();
        return CallOutcome.failure(categorize(cause), message);
    }

    private static Throwable unwrap(Throwable failure) {
        var current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
