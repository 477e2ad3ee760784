package org.geodecode.core;

import org.geodecode.model.Location;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link GeocoderService#query(List)}.
 * <p>
 * Either a positional list of results (one entry per input coordinate, empty
 * when nothing was found) or the batch-level invalid signal, raised when any
 * input coordinate is out of range. There are no partial lists.
 * </p>
 */
public final class BatchQueryResult {

    private static final BatchQueryResult INVALID = new BatchQueryResult(false, List.of());
    private static final BatchQueryResult EMPTY = new BatchQueryResult(true, List.of());

    private final boolean valid;
    private final List<Optional<Location>> results;

    private BatchQueryResult(boolean valid, List<Optional<Location>> results) {
        this.valid = valid;
        this.results = results;
    }

    /**
     * @return the batch-level invalid signal.
     */
    public static BatchQueryResult invalid() {
        return INVALID;
    }

    /**
     * @return a valid result with no entries.
     */
    public static BatchQueryResult empty() {
        return EMPTY;
    }

    /**
     * @param results per-coordinate results in input order.
     */
    public static BatchQueryResult of(List<Optional<Location>> results) {
        Objects.requireNonNull(results, "results");
        return results.isEmpty() ? EMPTY : new BatchQueryResult(true, List.copyOf(results));
    }

    /**
     * @return false when the batch was rejected as a whole.
     */
    public boolean isValid() {
        return valid;
    }

    /**
     * Positional results. Empty for the invalid signal.
     */
    public List<Optional<Location>> results() {
        return results;
    }

    public int size() {
        return results.size();
    }

    /**
     * @param position input position.
     * @return result at that position.
     */
    public Optional<Location> get(int position) {
        return results.get(position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BatchQueryResult)) {
            return false;
        }
        BatchQueryResult that = (BatchQueryResult) o;
        return valid == that.valid && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(valid, results);
    }

    @Override
    public String toString() {
        return valid ? "BatchQueryResult" + results : "BatchQueryResult[invalid]";
    }
}
