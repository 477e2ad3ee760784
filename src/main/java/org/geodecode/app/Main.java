package org.geodecode.app;

import org.geodecode.core.BatchQueryResult;
import org.geodecode.core.GeocoderService;
import org.geodecode.model.Coordinate;
import org.geodecode.model.Location;

import java.util.List;
import java.util.Optional;

/**
 * Minimal application entry point used for local smoke runs against the bundled dataset.
 */
public class Main {
    /**
     * Runs a few sample lookups and prints the results.
     *
     * @param args {@code --verbose} enables load diagnostics.
     */
    public static void main(String[] args) {
        boolean verbose = List.of(args).contains("--verbose");
        GeocoderService geocoder = GeocoderService.withDefaults(verbose);
        System.out.println("Geocoder instantiated, but data not loaded yet.");

        System.out.println();
        System.out.println("Single coordinate lookups...");
        printSingle(geocoder, Coordinate.of(37.78674, -122.39222)); // San Francisco
        printSingle(geocoder, Coordinate.of(48.8566, 2.3522)); // Paris

        System.out.println();
        System.out.println("Batch lookup...");
        List<Coordinate> batch = List.of(
                Coordinate.of(52.5200, 13.4050), // Berlin
                Coordinate.of(40.7128, -74.0060), // New York City
                Coordinate.of(-33.8688, 151.2093) // Sydney
        );
        BatchQueryResult results = geocoder.query(batch);
        for (int i = 0; i < batch.size(); i++) {
            System.out.println("  " + format(batch.get(i)) + ": " + describe(results.isValid() ? results.get(i) : Optional.empty()));
        }

        System.out.println();
        System.out.println("Coordinate in the ocean...");
        printSingle(geocoder, Coordinate.of(0.0, 0.0));

        System.out.println();
        System.out.println("Empty batch...");
        System.out.println("  " + geocoder.query(List.of()));
    }

    private static void printSingle(GeocoderService geocoder, Coordinate coordinate) {
        System.out.println("Result for " + format(coordinate) + ": " + describe(geocoder.findLocation(coordinate)));
    }

    private static String format(Coordinate coordinate) {
        return "[" + coordinate.lat() + ", " + coordinate.lon() + "]";
    }

    private static String describe(Optional<Location> location) {
        return location.map(Location::toString).orElse("Not found");
    }
}
