package org.geodecode.model;

/**
 * Latitude/longitude pair in degrees.
 *
 * @param lat latitude.
 * @param lon longitude.
 */
public record Coordinate(double lat, double lon) {
    public static final double MIN_LAT = -90.0;
    public static final double MAX_LAT = 90.0;
    public static final double MIN_LON = -180.0;
    public static final double MAX_LON = 180.0;

    /**
     * Convenience factory mirroring the {@code [lat, lon]} argument order.
     */
    public static Coordinate of(double lat, double lon) {
        return new Coordinate(lat, lon);
    }

    /**
     * Range check with inclusive bounds. NaN never passes.
     */
    public static boolean isValid(double lat, double lon) {
        return lat >= MIN_LAT && lat <= MAX_LAT && lon >= MIN_LON && lon <= MAX_LON;
    }

    /**
     * @return true when both components are inside the geographic range.
     */
    public boolean isValid() {
        return isValid(lat, lon);
    }
}
