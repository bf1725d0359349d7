package scanagram.core.model.profile;

/**
 * Public metadata of a profile.
 */
public record ProfileMetadata(
        String username,
        String fullName,
        String biography,
        String externalUrl,
        long followers,
        long following,
        long postsCount,
        boolean privateProfile,
        boolean verified,
        boolean business,
        String businessCategory,
        String profilePicUrl,
        String userId) {

    public ProfileMetadata {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username is required");
        }
        if (fullName == null) {
            fullName = "";
        }
        if (biography == null) {
            biography = "";
        }
        if (!business) {
            businessCategory = null;
        }
    }
}
