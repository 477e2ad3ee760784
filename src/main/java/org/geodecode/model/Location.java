package org.geodecode.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Immutable dataset entry: a named place with its administrative metadata.
 * <p>
 * {@code country} stays empty while the record sits in the dataset; lookups
 * that resolve a display name return a copy via {@link #withCountry(String)}.
 * </p>
 */
@Value
@Builder
public class Location {
    /**
     * Latitude in degrees, within [-90, 90].
     */
    double lat;

    /**
     * Longitude in degrees, within [-180, 180].
     */
    double lon;

    /**
     * Primary place name (city, town).
     */
    @Builder.Default
    String city = "";

    /**
     * First-level administrative division (state, province).
     */
    @Builder.Default
    String admin1 = "";

    /**
     * Second-level administrative division (county, district).
     */
    @Builder.Default
    String admin2 = "";

    /**
     * ISO 3166-1 alpha-2 country code.
     */
    @Builder.Default
    String cc = "";

    @With
    @Builder.Default
    String country = "";

    /**
     * @return coordinate of this record.
     */
    public Coordinate coordinate() {
        return new Coordinate(lat, lon);
    }
}
