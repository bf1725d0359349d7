package scanagram.core.model.profile;

import java.util.List;
import java.util.Optional;

/**
 * One page of a profile's post listing, newest first.
 *
 * @param posts      posts on this page
 * @param nextCursor cursor of the following page, empty on the last page
 */
public record PostPage(List<PostRecord> posts, Optional<String> nextCursor) {

    public PostPage {
        posts = posts == null ? List.of() : List.copyOf(posts);
        if (nextCursor == null) {
            nextCursor = Optional.empty();
        }
    }

    public boolean hasNext() {
        return nextCursor.isPresent();
    }
}
