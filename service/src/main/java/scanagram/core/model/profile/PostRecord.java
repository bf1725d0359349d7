package scanagram.core.model.profile;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One fetched post.
 *
 * <p>The timestamp keeps the offset the post was published in, so hour-of-day
 * statistics reflect the author's local time. Hashtags keep their caption order.
 *
 * @param shortcode   the post's short identifier
 * @param url         public URL of the post
 * @param caption     caption text, truncated to {@link #MAX_CAPTION_LENGTH}, or {@code null}
 * @param timestamp   publication time
 * @param likes       like count
 * @param comments    comment count
 * @param hashtags    hashtags in caption order, without the leading '#'
 * @param location    geotag, or {@code null}
 * @param video       whether the post is a video
 * @param typeName    the remote service's content type name
 * @param taggedUsers usernames tagged in the post
 */
public record PostRecord(
        String shortcode,
        String url,
        String caption,
        OffsetDateTime timestamp,
        long likes,
        long comments,
        Set<String> hashtags,
        GeoTag location,
        boolean video,
        String typeName,
        List<String> taggedUsers) {

    public static final int MAX_CAPTION_LENGTH = 500;

    public PostRecord {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
        if (likes < 0) {
            throw new IllegalArgumentException("likes must not be negative, got: " + likes);
        }
        if (comments < 0) {
            throw new IllegalArgumentException("comments must not be negative, got: " + comments);
        }
        if (caption != null && caption.length() > MAX_CAPTION_LENGTH) {
            caption = caption.substring(0, MAX_CAPTION_LENGTH);
        }
        hashtags = hashtags == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(hashtags));
        taggedUsers = taggedUsers == null ? List.of() : List.copyOf(taggedUsers);
    }

    public long engagement() {
        return likes + comments;
    }
}
