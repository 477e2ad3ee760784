package org.geodecode.spatial;

import org.geodecode.testutil.SpatialFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Spatial Index Shape Tests")
class SpatialIndexTest {

    @Test
    @DisplayName("Zero keys produce the shared empty index")
    void testEmptyShape() {
        SpatialIndex index = SpatialIndex.build(List.of());

        assertSame(SpatialIndex.empty(), index);
        assertEquals(SpatialIndex.Shape.EMPTY, index.shape());
        assertTrue(index.isEmpty());
        assertEquals(0, index.size());
        assertNull(index.tree());
        assertNull(index.singleKey());
    }

    @Test
    @DisplayName("One key is held directly without building a tree")
    void testSingleKeyShape() {
        IndexKey only = new IndexKey(5.0, 5.0, 0);
        SpatialIndex index = SpatialIndex.build(List.of(only));

        assertEquals(SpatialIndex.Shape.SINGLE_KEY, index.shape());
        assertFalse(index.isEmpty());
        assertEquals(1, index.size());
        assertSame(only, index.singleKey());
        assertNull(index.tree());
    }

    @Test
    @DisplayName("Two or more keys build a KD tree over all of them")
    void testTreeShape() {
        IndexKey[] keys = SpatialFixtures.randomKeys(64, 4L);
        SpatialIndex index = SpatialIndex.build(Arrays.asList(keys));

        assertEquals(SpatialIndex.Shape.TREE, index.shape());
        assertEquals(64, index.size());
        assertNull(index.singleKey());
        assertNotNull(index.tree());
        assertEquals(64, index.tree().nodeCount());
    }

    @Test
    @DisplayName("Null inputs are rejected")
    void testNullRejected() {
        assertThrows(NullPointerException.class, () -> SpatialIndex.build(null));
        assertThrows(NullPointerException.class, () -> SpatialIndex.build(Arrays.asList((IndexKey) null)));
        assertThrows(IllegalArgumentException.class, () -> new IndexKey(0.0, 0.0, -1));
    }
}
