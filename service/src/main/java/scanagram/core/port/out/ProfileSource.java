package scanagram.core.port.out;

import io.smallrye.mutiny.Uni;

import scanagram.core.model.governor.CallOutcome;
import scanagram.core.model.profile.PostPage;
import scanagram.core.model.profile.ProfileMetadata;

/**
 * Port for the remote service holding profile data.
 *
 * <p>Every method performs exactly one remote call and reports its result as a
 * {@link CallOutcome}. Implementations should classify failures themselves
 * rather than fail the returned {@link Uni}; failures that do escape are
 * classified by the governor.
 */
public interface ProfileSource {

    /**
     * Fetch a profile's public metadata.
     *
     * @param username the profile to fetch
     * @return the outcome of the call
     */
    Uni<CallOutcome<ProfileMetadata>> fetchProfile(String username);

    /**
     * Fetch one page of a profile's posts, newest first.
     *
     * @param username the profile
     * @param cursor   cursor from the previous page, or {@code null} for the first page
     * @param limit    maximum posts on the page
     * @return the outcome of the call
     */
    Uni<CallOutcome<PostPage>> fetchPostPage(String username, String cursor, int limit);
}
