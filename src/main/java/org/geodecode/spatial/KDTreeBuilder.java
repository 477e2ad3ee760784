package org.geodecode.spatial;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.Objects;

/**
 * Balanced KD tree construction by recursive median partitioning.
 *
 * <p>Split axis alternates latitude/longitude by depth. The median of each
 * range is located with an in-place three-way quickselect, so the total build
 * cost is O(n log n) expected and runs of identical coordinates partition in
 * linear time.</p>
 *
 * <p>Nodes are emitted in pre-order into flat arrays; the root is node 0.</p>
 */
@UtilityClass
public final class KDTreeBuilder {

    /**
     * Builds a tree over a non-empty key collection. The input is not modified.
     *
     * @param keys index keys, at least one.
     * @return immutable tree.
     */
    public static KDTree build(Collection<IndexKey> keys) {
        Objects.requireNonNull(keys, "keys");
        return build(keys.toArray(new IndexKey[0]));
    }

    /**
     * Builds a tree over a non-empty key array. The input array is not modified.
     *
     * @param keys index keys, at least one.
     * @return immutable tree.
     */
    public static KDTree build(IndexKey[] keys) {
        Objects.requireNonNull(keys, "keys");
        if (keys.length == 0) {
            throw new IllegalArgumentException("keys must be non-empty");
        }
        IndexKey[] work = keys.clone();
        for (int i = 0; i < work.length; i++) {
            if (work[i] == null) {
                throw new IllegalArgumentException("keys[" + i + "] is null");
            }
        }

        TreeBuffers buffers = new TreeBuffers(work.length);
        int root = buildRange(work, 0, work.length, 0, buffers);
        return new KDTree(
                root,
                buffers.nodeKeys.toArray(new IndexKey[0]),
                buffers.leftChildren.toIntArray(),
                buffers.rightChildren.toIntArray(),
                buffers.splitAxes.toByteArray()
        );
    }

    /**
     * Emits the subtree for {@code keys[from, to)} and returns its node id, or -1 for an empty range.
     */
    private static int buildRange(IndexKey[] keys, int from, int to, int depth, TreeBuffers buffers) {
        if (from >= to) {
            return KDTree.NO_CHILD;
        }

        int axis = depth % IndexKey.DIMENSIONS;
        int median = from + ((to - from) >>> 1);
        select(keys, from, to - 1, median, axis);

        int node = buffers.append(keys[median], axis);
        if (to - from == 1) {
            return node;
        }

        buffers.leftChildren.set(node, buildRange(keys, from, median, depth + 1, buffers));
        buffers.rightChildren.set(node, buildRange(keys, median + 1, to, depth + 1, buffers));
        return node;
    }

    /**
     * Rearranges {@code keys[left..right]} so that position {@code k} holds the
     * element of rank {@code k} on {@code axis}, everything before it is {@code <=}
     * and everything after it is {@code >=}.
     */
    static void select(IndexKey[] keys, int left, int right, int k, int axis) {
        while (right > left) {
            int pivotIndex = medianOfThree(keys, left, left + ((right - left) >>> 1), right, axis);
            double pivot = keys[pivotIndex].coordinate(axis);

            // [left, lt) < pivot, [lt, gt] == pivot, (gt, right] > pivot
            int lt = left;
            int gt = right;
            int i = left;
            while (i <= gt) {
                double value = keys[i].coordinate(axis);
                if (value < pivot) {
                    swap(keys, lt++, i++);
                } else if (value > pivot) {
                    swap(keys, i, gt--);
                } else {
                    i++;
                }
            }

            if (k < lt) {
                right = lt - 1;
            } else if (k > gt) {
                left = gt + 1;
            } else {
                return;
            }
        }
    }

    private static int medianOfThree(IndexKey[] keys, int a, int b, int c, int axis) {
        double va = keys[a].coordinate(axis);
        double vb = keys[b].coordinate(axis);
        double vc = keys[c].coordinate(axis);
        if (va < vb) {
            if (vb < vc) {
                return b;
            }
            return va < vc ? c : a;
        }
        if (va < vc) {
            return a;
        }
        return vb < vc ? c : b;
    }

    private static void swap(IndexKey[] keys, int i, int j) {
        IndexKey tmp = keys[i];
        keys[i] = keys[j];
        keys[j] = tmp;
    }

    /**
     * Growable node buffers, trimmed into arrays once the build finishes.
     */
    private static final class TreeBuffers {
        private final ObjectArrayList<IndexKey> nodeKeys;
        private final IntArrayList leftChildren;
        private final IntArrayList rightChildren;
        private final ByteArrayList splitAxes;

        private TreeBuffers(int expectedNodes) {
            this.nodeKeys = new ObjectArrayList<>(expectedNodes);
            this.leftChildren = new IntArrayList(expectedNodes);
            this.rightChildren = new IntArrayList(expectedNodes);
            this.splitAxes = new ByteArrayList(expectedNodes);
        }

        private int append(IndexKey key, int axis) {
            int node = nodeKeys.size();
            nodeKeys.add(key);
            leftChildren.add(KDTree.NO_CHILD);
            rightChildren.add(KDTree.NO_CHILD);
            splitAxes.add((byte) axis);
            return node;
        }
    }
}
