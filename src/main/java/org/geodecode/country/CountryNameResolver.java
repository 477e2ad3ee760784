package org.geodecode.country;

/**
 * Maps ISO 3166-1 alpha-2 country codes to display names.
 */
@FunctionalInterface
public interface CountryNameResolver {

    /**
     * @param countryCode alpha-2 code, case-insensitive.
     * @return display name, or an empty string when the code is unknown.
     */
    String displayName(String countryCode);
}
