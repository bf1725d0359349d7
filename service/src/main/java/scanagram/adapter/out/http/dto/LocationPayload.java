package scanagram.adapter.out.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import scanagram.core.model.profile.GeoTag;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LocationPayload(
        @JsonProperty("name") String name, @JsonProperty("lat") Double latitude, @JsonProperty("lng") Double longitude) {

    /**
     * Convert to a geotag.
     *
     * @return the geotag, or {@code null} when the location has no name
     */
    public GeoTag toDomain() {
        if (name == null || name.isBlank()) {
            return null;
        }
        return new GeoTag(name, latitude, longitude);
    }
}
