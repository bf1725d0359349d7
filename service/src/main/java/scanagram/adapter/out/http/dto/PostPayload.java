package scanagram.adapter.out.http.dto;

import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import scanagram.core.model.profile.PostRecord;
import scanagram.core.util.HashtagExtractor;

/**
 * Post as returned in a post page.
 *
 * <p>{@code timestamp} is ISO-8601 with offset. When {@code hashtags} is
 * missing, tags are taken from the caption.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PostPayload(
        @JsonProperty("shortcode") String shortcode,
        @JsonProperty("url") String url,
        @JsonProperty("caption") String caption,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("likes") long likes,
        @JsonProperty("comments") long comments,
        @JsonProperty("hashtags") List<String> hashtags,
        @JsonProperty("location") LocationPayload location,
        @JsonProperty("isVideo") boolean video,
        @JsonProperty("typeName") String typeName,
        @JsonProperty("taggedUsers") List<String> taggedUsers) {

    /**
     * Convert to a post record.
     *
     * @return the record
     * @throws java.time.format.DateTimeParseException if the timestamp is malformed
     * @throws IllegalArgumentException                if the timestamp is missing
     */
    public PostRecord toDomain() {
        if (timestamp == null) {
            throw new IllegalArgumentException("Post " + shortcode + " has no timestamp");
        }
        final var tags = hashtags != null ? new LinkedHashSet<>(hashtags) : HashtagExtractor.extract(caption);
        return new PostRecord(
                shortcode,
                url,
                caption,
                OffsetDateTime.parse(timestamp),
                Math.max(0L, likes),
                Math.max(0L, comments),
                tags,
                location != null ? location.toDomain() : null,
                video,
                typeName,
                taggedUsers);
    }
}
