package scanagram.adapter.out.http.dto;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import scanagram.core.model.profile.PostPage;
import scanagram.core.model.profile.PostRecord;

/**
 * Body of {@code GET /profiles/{username}/posts}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PostPagePayload(
        @JsonProperty("posts") List<PostPayload> posts, @JsonProperty("nextCursor") String nextCursor) {

    /**
     * Convert to a post page, dropping posts that cannot be converted.
     *
     * @param onRejected receives each dropped post and the reason it was dropped
     * @return the page
     */
    public PostPage toDomain(BiConsumer<PostPayload, RuntimeException> onRejected) {
        final var records = new ArrayList<PostRecord>();
        if (posts != null) {
            for (final var post : posts) {
                if (post == null) {
                    continue;
                }
                try {
                    records.add(post.toDomain());
                } catch (IllegalArgumentException | DateTimeException e) {
                    onRejected.accept(post, e);
                }
            }
        }
        final var cursor = nextCursor == null || nextCursor.isBlank() ? Optional.<String>empty() : Optional.of(nextCursor);
        return new PostPage(List.copyOf(records), cursor);
    }
}
