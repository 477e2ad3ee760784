package org.geodecode.spatial;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Collection;
import java.util.Objects;

/**
 * Built spatial index in one of its three shapes.
 *
 * <ul>
 * <li>{@link Shape#EMPTY}: no keys, every lookup has no result.</li>
 * <li>{@link Shape#SINGLE_KEY}: exactly one key, held directly without a tree.</li>
 * <li>{@link Shape#TREE}: two or more keys in a {@link KDTree}.</li>
 * </ul>
 *
 * Callers branch on {@link #shape()}; only the tree shape reaches the query engine.
 */
@Getter
@Accessors(fluent = true)
public final class SpatialIndex {

    /**
     * Index representation chosen from the key count.
     */
    public enum Shape {
        EMPTY,
        SINGLE_KEY,
        TREE
    }

    private static final SpatialIndex EMPTY = new SpatialIndex(Shape.EMPTY, null, null, 0);

    private final Shape shape;
    private final IndexKey singleKey;
    private final KDTree tree;
    private final int size;

    private SpatialIndex(Shape shape, IndexKey singleKey, KDTree tree, int size) {
        this.shape = shape;
        this.singleKey = singleKey;
        this.tree = tree;
        this.size = size;
    }

    /**
     * @return shared empty index.
     */
    public static SpatialIndex empty() {
        return EMPTY;
    }

    /**
     * Builds the index shape that fits the number of keys.
     *
     * @param keys keys to index; may be empty.
     */
    public static SpatialIndex build(Collection<IndexKey> keys) {
        Objects.requireNonNull(keys, "keys");
        if (keys.isEmpty()) {
            return EMPTY;
        }
        if (keys.size() == 1) {
            IndexKey only = Objects.requireNonNull(keys.iterator().next(), "keys[0]");
            return new SpatialIndex(Shape.SINGLE_KEY, only, null, 1);
        }
        return new SpatialIndex(Shape.TREE, null, KDTreeBuilder.build(keys), keys.size());
    }

    public boolean isEmpty() {
        return shape == Shape.EMPTY;
    }

    @Override
    public String toString() {
        return "SpatialIndex[shape=" + shape + ", size=" + size + "]";
    }
}
