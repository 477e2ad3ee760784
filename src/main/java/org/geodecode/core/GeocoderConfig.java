package org.geodecode.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.geodecode.country.CountryNameResolver;
import org.geodecode.country.LocaleCountryNameResolver;
import org.geodecode.loader.CsvLocationSource;
import org.geodecode.loader.LocationSource;

/**
 * Construction-time configuration for {@link GeocoderService}. Immutable.
 */
@Value
@Builder
public class GeocoderConfig {
    /**
     * Logs load progress, skipped rows and rejected query coordinates at info/warn level.
     */
    boolean verbose;

    /**
     * Dataset supplier, invoked once on first use.
     */
    @NonNull
    @Builder.Default
    LocationSource source = new CsvLocationSource();

    /**
     * Resolves {@link org.geodecode.model.Location#getCountry()} for single lookups.
     */
    @NonNull
    @Builder.Default
    CountryNameResolver countryNameResolver = new LocaleCountryNameResolver();

    /**
     * @return bundled dataset, quiet logging.
     */
    public static GeocoderConfig defaults() {
        return GeocoderConfig.builder().build();
    }
}
