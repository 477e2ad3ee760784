package org.geodecode.country;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CountryNameResolver} backed by the JDK's ISO country table.
 * <p>
 * Thread-safe. Names are rendered in the configured display locale
 * (English by default) and cached per code.
 * </p>
 */
public final class LocaleCountryNameResolver implements CountryNameResolver {

    private static final Set<String> ISO_COUNTRIES = Set.of(Locale.getISOCountries());

    private final Locale displayLocale;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public LocaleCountryNameResolver() {
        this(Locale.ENGLISH);
    }

    public LocaleCountryNameResolver(Locale displayLocale) {
        this.displayLocale = Objects.requireNonNull(displayLocale, "displayLocale");
    }

    @Override
    public String displayName(String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            return "";
        }
        String code = countryCode.trim().toUpperCase(Locale.ROOT);
        if (!ISO_COUNTRIES.contains(code)) {
            return "";
        }
        return cache.computeIfAbsent(code, c -> new Locale("", c).getDisplayCountry(displayLocale));
    }
}
