package org.geodecode.spatial;

/**
 * Immutable 2-d KD tree over {@link IndexKey}s with nearest-neighbor lookup.
 * <p>
 * Array-backed: node {@code i} holds {@code nodeKeys[i]}, splits on
 * {@code splitAxes[i]} and points at its children through
 * {@code leftChildren[i]} / {@code rightChildren[i]} ({@link #NO_CHILD} when absent).
 * Every key in the left subtree is {@code <=} the node key on its split axis,
 * every key in the right subtree is {@code >=}.
 * </p>
 * <p>
 * Built by {@link KDTreeBuilder}. Nothing is mutated after construction, so
 * concurrent readers need no synchronization.
 * </p>
 */
public final class KDTree {
    static final int NO_CHILD = -1;

    private final int rootIndex;
    private final IndexKey[] nodeKeys;
    private final int[] leftChildren;
    private final int[] rightChildren;
    private final byte[] splitAxes;

    KDTree(int rootIndex, IndexKey[] nodeKeys, int[] leftChildren, int[] rightChildren, byte[] splitAxes) {
        this.rootIndex = rootIndex;
        this.nodeKeys = nodeKeys;
        this.leftChildren = leftChildren;
        this.rightChildren = rightChildren;
        this.splitAxes = splitAxes;
    }

    /**
     * Number of nodes (one per key).
     */
    public int nodeCount() {
        return nodeKeys.length;
    }

    /**
     * Finds the key with minimal squared planar distance to the query point.
     * <p>
     * Branch and bound: the near side of each split is visited first and the
     * far side only when the squared distance to the split line is strictly
     * below the best distance found so far. Among equally distant keys the one
     * reached first in that traversal order is kept.
     * </p>
     *
     * @return nearest key with its squared distance.
     */
    public NearestMatch nearest(double queryLat, double queryLon) {
        validateQueryCoordinate(queryLat, "queryLat");
        validateQueryCoordinate(queryLon, "queryLon");

        Search search = new Search(queryLat, queryLon);
        search.visit(rootIndex);
        if (search.bestNode < 0) {
            throw new IllegalStateException("KD tree has no reachable nodes");
        }
        return new NearestMatch(nodeKeys[search.bestNode], search.bestDistanceSquared);
    }

    /**
     * Computes the height of the tree (a single node has depth 1).
     */
    public int depth() {
        return depth(rootIndex);
    }

    int rootIndex() {
        return rootIndex;
    }

    IndexKey key(int node) {
        return nodeKeys[node];
    }

    int leftChild(int node) {
        return leftChildren[node];
    }

    int rightChild(int node) {
        return rightChildren[node];
    }

    int splitAxis(int node) {
        return splitAxes[node];
    }

    private int depth(int node) {
        if (node == NO_CHILD) {
            return 0;
        }
        return 1 + Math.max(depth(leftChildren[node]), depth(rightChildren[node]));
    }

    @Override
    public String toString() {
        return "KDTree[nodes=" + nodeKeys.length + ", root=" + rootIndex + "]";
    }

    private static void validateQueryCoordinate(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite");
        }
    }

    /**
     * Per-query traversal state.
     */
    private final class Search {
        private final double queryLat;
        private final double queryLon;
        private int bestNode = NO_CHILD;
        private double bestDistanceSquared = Double.POSITIVE_INFINITY;

        private Search(double queryLat, double queryLon) {
            this.queryLat = queryLat;
            this.queryLon = queryLon;
        }

        private void visit(int node) {
            if (node == NO_CHILD) {
                return;
            }

            IndexKey key = nodeKeys[node];
            double distanceSquared = key.distanceSquared(queryLat, queryLon);
            if (distanceSquared < bestDistanceSquared) {
                bestDistanceSquared = distanceSquared;
                bestNode = node;
            }

            int axis = splitAxes[node];
            double queryCoordinate = axis == IndexKey.AXIS_LAT ? queryLat : queryLon;
            double delta = queryCoordinate - key.coordinate(axis);

            int nearChild = delta <= 0.0 ? leftChildren[node] : rightChildren[node];
            int farChild = delta <= 0.0 ? rightChildren[node] : leftChildren[node];

            visit(nearChild);
            if (farChild != NO_CHILD && delta * delta < bestDistanceSquared) {
                visit(farChild);
            }
        }
    }
}
