package org.geodecode.core;

import org.geodecode.model.Location;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Batch Query Result Tests")
class BatchQueryResultTest {

    @Test
    @DisplayName("Invalid signal and empty result are distinct")
    void testInvalidVersusEmpty() {
        assertFalse(BatchQueryResult.invalid().isValid());
        assertTrue(BatchQueryResult.empty().isValid());
        assertEquals(0, BatchQueryResult.invalid().size());
        assertEquals(0, BatchQueryResult.empty().size());
        assertNotEquals(BatchQueryResult.invalid(), BatchQueryResult.empty());
        assertSame(BatchQueryResult.empty(), BatchQueryResult.of(List.of()));
    }

    @Test
    @DisplayName("Positional results are copied and immutable")
    void testResultsCopied() {
        Location place = Location.builder().lat(1.0).lon(2.0).city("X").cc("ZZ").build();
        List<Optional<Location>> source = new ArrayList<>();
        source.add(Optional.of(place));
        source.add(Optional.empty());

        BatchQueryResult result = BatchQueryResult.of(source);
        source.clear();

        assertEquals(2, result.size());
        assertEquals(Optional.of(place), result.get(0));
        assertEquals(Optional.empty(), result.get(1));
        assertThrows(UnsupportedOperationException.class, () -> result.results().add(Optional.empty()));
        assertEquals(result, BatchQueryResult.of(List.of(Optional.of(place), Optional.empty())));
    }
}
