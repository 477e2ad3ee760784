package org.geodecode.loader;

import org.geodecode.model.Location;

import java.util.List;

/**
 * Supplies the reference dataset to the geocoder.
 *
 * <p>Implementations must only return records whose latitude lies in [-90, 90]
 * and longitude in [-180, 180]. Missing or malformed data is reported through
 * logging and an empty (or shorter) list, not by throwing.</p>
 */
@FunctionalInterface
public interface LocationSource {

    /**
     * Loads all valid records in source order.
     *
     * @param verbose when true, per-row diagnostics and timings are logged at info/warn level.
     * @return immutable list of records; empty when nothing could be loaded.
     */
    List<Location> load(boolean verbose);

    /**
     * Source backed by a fixed in-memory list.
     *
     * @param locations records to serve; must already be range-valid.
     */
    static LocationSource of(List<Location> locations) {
        List<Location> copy = List.copyOf(locations);
        return verbose -> copy;
    }
}
