package scanagram.core.model.profile;

/**
 * Location attached to a post.
 *
 * @param name      display name of the location
 * @param latitude  latitude, or {@code null} when not published
 * @param longitude longitude, or {@code null} when not published
 */
public record GeoTag(String name, Double latitude, Double longitude) {

    public GeoTag {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("location name is required");
        }
    }
}
