package org.geodecode.spatial;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Lightweight spatial index entry: a 2-d coordinate plus the position of the
 * owning record in the dataset.
 * <p>
 * Axis 0 is latitude, axis 1 is longitude. Immutable.
 * </p>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class IndexKey {
    public static final int DIMENSIONS = 2;
    public static final int AXIS_LAT = 0;
    public static final int AXIS_LON = 1;

    private final double lat;
    private final double lon;
    private final int recordIndex;

    /**
     * @param lat latitude component.
     * @param lon longitude component.
     * @param recordIndex dataset position, must be >= 0.
     */
    public IndexKey(double lat, double lon, int recordIndex) {
        if (recordIndex < 0) {
            throw new IllegalArgumentException("recordIndex must be >= 0, got " + recordIndex);
        }
        this.lat = lat;
        this.lon = lon;
        this.recordIndex = recordIndex;
    }

    /**
     * Coordinate value on one axis.
     *
     * @param axis {@link #AXIS_LAT} or {@link #AXIS_LON}.
     */
    public double coordinate(int axis) {
        return axis == AXIS_LAT ? lat : lon;
    }

    /**
     * Planar squared distance to the query point.
     */
    public double distanceSquared(double queryLat, double queryLon) {
        double dLat = lat - queryLat;
        double dLon = lon - queryLon;
        return dLat * dLat + dLon * dLon;
    }
}
