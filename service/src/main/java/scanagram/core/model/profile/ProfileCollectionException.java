package scanagram.core.model.profile;

import java.time.Duration;
import java.util.Locale;

import scanagram.core.model.governor.GovernorException;
import scanagram.core.model.governor.GovernorResult;

/**
 * Thrown when a profile report cannot be produced because a required remote
 * call failed.
 */
public class ProfileCollectionException extends GovernorException {

    /**
     * Collection step that failed.
     */
    public enum Stage {
        PROFILE,
        POSTS
    }

    private final String username;
    private final Stage stage;
    private final Duration retryAfter;

    public ProfileCollectionException(String username, Stage stage, GovernorResult<?> result, Duration retryAfter) {
        super("Collecting %s of %s failed. %s".formatted(stage.name().toLowerCase(Locale.ROOT), username, describe(result)), result);
        this.username = username;
        this.stage = stage;
        this.retryAfter = retryAfter;
    }

    public String username() {
        return username;
    }

    public Stage stage() {
        return stage;
    }

    /**
     * Suggested wait before asking for this profile again.
     *
     * @return the wait
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
