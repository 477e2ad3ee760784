package org.geodecode.spatial;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Immutable nearest-neighbor match result for spatial queries.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class NearestMatch {
    private final IndexKey key;
    private final double distanceSquared;

    /**
     * @return dataset position of the matched key.
     */
    public int recordIndex() {
        return key.recordIndex();
    }
}
