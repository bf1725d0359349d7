package scanagram.adapter.out.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import scanagram.core.model.profile.ProfileMetadata;

/**
 * Profile as returned by {@code GET /profiles/{username}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProfilePayload(
        @JsonProperty("id") String id,
        @JsonProperty("username") String username,
        @JsonProperty("fullName") String fullName,
        @JsonProperty("biography") String biography,
        @JsonProperty("externalUrl") String externalUrl,
        @JsonProperty("followers") long followers,
        @JsonProperty("following") long following,
        @JsonProperty("postsCount") long postsCount,
        @JsonProperty("isPrivate") boolean privateProfile,
        @JsonProperty("isVerified") boolean verified,
        @JsonProperty("isBusiness") boolean business,
        @JsonProperty("businessCategory") String businessCategory,
        @JsonProperty("profilePicUrl") String profilePicUrl) {

    public ProfileMetadata toDomain() {
        return new ProfileMetadata(
                username,
                fullName,
                biography,
                externalUrl,
                Math.max(0L, followers),
                Math.max(0L, following),
                Math.max(0L, postsCount),
                privateProfile,
                verified,
                business,
                businessCategory,
                profilePicUrl,
                id);
    }
}
