package org.geodecode.core;

import lombok.extern.slf4j.Slf4j;
import org.geodecode.model.Coordinate;
import org.geodecode.model.Location;
import org.geodecode.spatial.IndexKey;
import org.geodecode.spatial.NearestMatch;
import org.geodecode.spatial.SpatialIndex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * Reverse geocoder: resolves a coordinate to the nearest dataset place.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>The dataset is loaded and indexed lazily, exactly once per instance, on the
 * first query or {@link #ensureLoaded()}. Concurrent first callers block until that
 * single build completes.</li>
 * <li>A load that yields no valid records leaves the service permanently
 * {@link State#EMPTY}; lookups then return no result.</li>
 * <li>Out-of-range input never throws: single lookups return empty, batches return
 * {@link BatchQueryResult#invalid()}.</li>
 * <li>After loading, dataset and index are immutable and read without locks.</li>
 * </ul>
 */
@Slf4j
public final class GeocoderService {

    /**
     * Lifecycle of one service instance. {@code EMPTY} and {@code READY} are terminal.
     */
    public enum State {
        UNLOADED,
        LOADING,
        EMPTY,
        READY
    }

    private final GeocoderConfig config;
    private final FutureTask<LoadedDataset> loadTask;
    private volatile State state = State.UNLOADED;

    public GeocoderService(GeocoderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.loadTask = new FutureTask<>(this::load);
    }

    /**
     * @return service over the bundled dataset.
     */
    public static GeocoderService withDefaults(boolean verbose) {
        return new GeocoderService(GeocoderConfig.builder().verbose(verbose).build());
    }

    /**
     * Loads the dataset and builds the index if that has not happened yet.
     * Safe to call from many threads; the build runs once and every caller
     * returns only after it finished.
     *
     * @throws GeocoderException when interrupted while waiting for the build.
     */
    public void ensureLoaded() {
        awaitDataset();
    }

    /**
     * Current lifecycle state. Does not trigger loading.
     */
    public State state() {
        return state;
    }

    /**
     * Number of indexed records. Triggers loading.
     */
    public int size() {
        return awaitDataset().locations.size();
    }

    public GeocoderConfig config() {
        return config;
    }

    /**
     * Finds the nearest place for every coordinate.
     * <p>
     * If any coordinate is out of range (or null) the whole batch is rejected with
     * {@link BatchQueryResult#invalid()} and no lookup is performed. This
     * all-or-nothing behavior is kept for compatibility even though per-position
     * rejection would be more useful.
     * </p>
     *
     * @param coordinates query points.
     * @return one entry per coordinate in input order, or the batch-level invalid signal.
     */
    public BatchQueryResult query(List<Coordinate> coordinates) {
        Objects.requireNonNull(coordinates, "coordinates");
        LoadedDataset dataset = awaitDataset();

        if (coordinates.isEmpty()) {
            return BatchQueryResult.empty();
        }
        for (Coordinate coordinate : coordinates) {
            if (coordinate == null || !coordinate.isValid()) {
                logInvalidCoordinate(coordinate);
                return BatchQueryResult.invalid();
            }
        }

        List<Optional<Location>> results = new ArrayList<>(coordinates.size());
        for (Coordinate coordinate : coordinates) {
            results.add(dataset.lookup(coordinate));
        }
        return BatchQueryResult.of(results);
    }

    /**
     * Varargs form of {@link #query(List)}.
     */
    public BatchQueryResult query(Coordinate... coordinates) {
        Objects.requireNonNull(coordinates, "coordinates");
        return query(Arrays.asList(coordinates));
    }

    /**
     * Finds the nearest place to one coordinate, with its country name resolved.
     * Out-of-range input is rejected before the index is touched.
     *
     * @param coordinate query point.
     * @return nearest place, or empty for invalid input or an empty dataset.
     */
    public Optional<Location> findLocation(Coordinate coordinate) {
        if (coordinate == null || !coordinate.isValid()) {
            logInvalidCoordinate(coordinate);
            return Optional.empty();
        }

        BatchQueryResult result = query(List.of(coordinate));
        if (!result.isValid() || result.size() == 0) {
            return Optional.empty();
        }
        return result.get(0).map(location -> location.withCountry(
                config.getCountryNameResolver().displayName(location.getCc())));
    }

    /**
     * Convenience overload taking raw latitude/longitude.
     */
    public Optional<Location> findLocation(double lat, double lon) {
        return findLocation(Coordinate.of(lat, lon));
    }

    @Override
    public String toString() {
        return "GeocoderService[state=" + state + ", verbose=" + config.isVerbose() + "]";
    }

    private LoadedDataset awaitDataset() {
        loadTask.run();
        try {
            return loadTask.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeocoderException(GeocoderException.REASON_LOAD_INTERRUPTED,
                    "interrupted while waiting for the dataset to load", e);
        } catch (ExecutionException e) {
            // load() handles runtime failures itself; only errors get here
            throw new GeocoderException(GeocoderException.REASON_LOAD_FAILED,
                    "dataset load failed", e.getCause());
        }
    }

    /**
     * Run-once body of {@link #loadTask}.
     */
    private LoadedDataset load() {
        state = State.LOADING;
        boolean verbose = config.isVerbose();
        long start = System.nanoTime();
        if (verbose) {
            log.info("Loading and processing geodata...");
        }

        LoadedDataset dataset = LoadedDataset.EMPTY;
        try {
            List<Location> loaded = config.getSource().load(verbose);
            dataset = LoadedDataset.build(loaded == null ? List.of() : loaded);
        } catch (RuntimeException e) {
            log.error("Loading location data failed, geocoder stays empty: {}", e.getMessage(), e);
        } finally {
            state = dataset.index.isEmpty() ? State.EMPTY : State.READY;
        }

        int size = dataset.locations.size();
        if (size == 0) {
            log.warn("No valid coordinates loaded.");
        } else if (size == 1) {
            log.info("Only one valid coordinate loaded. KD tree will not be built.");
        }
        if (verbose && size > 0) {
            log.info("Data loaded, index built in {} ms. {} locations indexed.",
                    (System.nanoTime() - start) / 1_000_000L, size);
        }
        return dataset;
    }

    private void logInvalidCoordinate(Coordinate coordinate) {
        if (config.isVerbose()) {
            log.warn("Invalid query coordinate received: {}. Returning no result.", coordinate);
        }
    }

    /**
     * Records plus the index built over them. Keys refer to records by list position.
     */
    private static final class LoadedDataset {
        private static final LoadedDataset EMPTY = new LoadedDataset(List.of(), SpatialIndex.empty());

        private final List<Location> locations;
        private final SpatialIndex index;

        private LoadedDataset(List<Location> locations, SpatialIndex index) {
            this.locations = locations;
            this.index = index;
        }

        private static LoadedDataset build(List<Location> loaded) {
            List<Location> locations = new ArrayList<>(loaded.size());
            List<IndexKey> keys = new ArrayList<>(loaded.size());
            for (Location location : loaded) {
                if (location == null || !Coordinate.isValid(location.getLat(), location.getLon())) {
                    log.warn("Dropping record with out-of-range coordinates from source: {}", location);
                    continue;
                }
                keys.add(new IndexKey(location.getLat(), location.getLon(), locations.size()));
                locations.add(location);
            }
            if (locations.isEmpty()) {
                return EMPTY;
            }
            return new LoadedDataset(Collections.unmodifiableList(locations), SpatialIndex.build(keys));
        }

        private Optional<Location> lookup(Coordinate coordinate) {
            switch (index.shape()) {
                case EMPTY:
                    return Optional.empty();
                case SINGLE_KEY:
                    return Optional.of(record(index.singleKey().recordIndex()));
                case TREE:
                    NearestMatch match = index.tree().nearest(coordinate.lat(), coordinate.lon());
                    return Optional.of(record(match.recordIndex()));
                default:
                    throw new IllegalStateException("Unknown index shape: " + index.shape());
            }
        }

        private Location record(int recordIndex) {
            if (recordIndex < 0 || recordIndex >= locations.size()) {
                log.error("Spatial index returned invalid record index {} for dataset of size {}",
                        recordIndex, locations.size());
                throw new GeocoderException(GeocoderException.REASON_INDEX_INCONSISTENT,
                        "record index " + recordIndex + " out of bounds [0, " + locations.size() + ")");
            }
            return locations.get(recordIndex);
        }
    }
}
