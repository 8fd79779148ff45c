package org.tripweave.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.tripweave.planning.model.Spot;

/**
 * Raw catalogue entry as stored in {@code spots_<city>.json}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpotRecord {
    private String name;
    private Double lat;
    private Double lon;
    private String category;
    @JsonProperty("duration_minutes")
    private Integer durationMinutes;
    private Double rating;

    /**
     * Converts to a validated spot.
     *
     * @throws IllegalArgumentException when a required field is missing or out of range.
     */
    public Spot toSpot() {
        if (lat == null || lon == null) {
            throw new IllegalArgumentException("lat/lon missing for '" + name + "'");
        }
        return Spot.builder()
                .name(name)
                .lat(lat)
                .lon(lon)
                .category(category)
                .durationMinutes(durationMinutes)
                .rating(rating)
                .build();
    }
}
