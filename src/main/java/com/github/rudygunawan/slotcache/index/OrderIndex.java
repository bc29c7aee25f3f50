package com.github.rudygunawan.slotcache.index;

/**
 * A red-black tree of {@code (metric, slot)} pairs, sorted ascending by metric and then by slot.
 *
 * <p>The slot component makes every key unique, so entries with equal metrics still have a total
 * and deterministic order. The tree owns a pool of {@code capacity} nodes allocated up front;
 * inserting takes a node from the pool and removing returns it. A {@link Node} keeps its identity
 * for as long as it is in the tree, including across {@link #update(Node, long, int)}, which lets
 * other structures hold on to node references.
 *
 * <p>Complexity: insert, remove and update are O(log n); {@link #first()} and {@link #last()} are
 * O(log n); stepping with {@link #next(Node)} / {@link #previous(Node)} is amortized O(1).
 *
 * <p>This class is not thread-safe.
 */
public final class OrderIndex {

    /**
     * A tree node. The metric and slot are readable by anyone but only the tree changes them.
     */
    public static final class Node {
        long metric;
        int slot;
        Node left;
        Node right;
        Node parent;
        boolean red;

        Node() {
        }

        /**
         * Returns the ordering metric.
         */
        public long metric() {
            return metric;
        }

        /**
         * Returns the slot index this node points at.
         */
        public int slot() {
            return slot;
        }

        @Override
        public String toString() {
            return "Node(" + metric + ":" + slot + ")";
        }
    }

    private final Node nil;
    private final Node[] pool;
    private final Node[] free;
    private int freeCount;
    private Node root;
    private int size;
    private int modCount;

    /**
     * Creates an empty index able to hold {@code capacity} nodes.
     *
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public OrderIndex(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.nil = new Node();
        this.nil.left = nil;
        this.nil.right = nil;
        this.nil.parent = nil;
        this.pool = new Node[capacity];
        this.free = new Node[capacity];
        for (int i = 0; i < capacity; i++) {
            pool[i] = new Node();
        }
        this.root = nil;
        resetPool();
    }

    /**
     * Inserts {@code (metric, slot)} and returns its node.
     *
     * @throws IllegalStateException if the index already holds {@code capacity} nodes
     */
    public Node insert(long metric, int slot) {
        if (freeCount == 0) {
            throw new IllegalStateException("order index is full (" + pool.length + " nodes)");
        }
        Node node = free[--freeCount];
        free[freeCount] = null;
        node.metric = metric;
        node.slot = slot;
        link(node);
        size++;
        modCount++;
        return node;
    }

    /**
     * Removes {@code node} from the tree and returns it to the pool.
     */
    public void remove(Node node) {
        unlink(node);
        node.left = null;
        node.right = null;
        node.parent = null;
        free[freeCount++] = node;
        size--;
        modCount++;
    }

    /**
     * Changes the key of {@code node} to {@code (metric, slot)}, moving it within the tree if the
     * new key no longer fits between its neighbours. The node keeps its identity.
     *
     * @return {@code node}
     */
    public Node update(Node node, long metric, int slot) {
        if (node.metric == metric && node.slot == slot) {
            return node;
        }
        Node prev = previous(node);
        Node next = next(node);
        if ((prev == null || compare(prev.metric, prev.slot, metric, slot) < 0)
                && (next == null || compare(next.metric, next.slot, metric, slot) > 0)) {
            node.metric = metric;
            node.slot = slot;
        } else {
            unlink(node);
            node.metric = metric;
            node.slot = slot;
            link(node);
        }
        modCount++;
        return node;
    }

    /**
     * Returns the node with the smallest key, or {@code null} if the tree is empty.
     */
    public Node first() {
        return root == nil ? null : minimum(root);
    }

    /**
     * Returns the node with the largest key, or {@code null} if the tree is empty.
     */
    public Node last() {
        return root == nil ? null : maximum(root);
    }

    /**
     * Returns the in-order successor of {@code node}, or {@code null} if it is the last node.
     */
    public Node next(Node node) {
        if (node.right != nil) {
            return minimum(node.right);
        }
        Node x = node;
        Node y = x.parent;
        while (y != nil && x == y.right) {
            x = y;
            y = y.parent;
        }
        return y == nil ? null : y;
    }

    /**
     * Returns the in-order predecessor of {@code node}, or {@code null} if it is the first node.
     */
    public Node previous(Node node) {
        if (node.left != nil) {
            return maximum(node.left);
        }
        Node x = node;
        Node y = x.parent;
        while (y != nil && x == y.left) {
            x = y;
            y = y.parent;
        }
        return y == nil ? null : y;
    }

    /**
     * Removes every node.
     */
    public void clear() {
        for (Node node : pool) {
            node.left = null;
            node.right = null;
            node.parent = null;
        }
        root = nil;
        size = 0;
        modCount++;
        resetPool();
    }

    /**
     * Returns the number of nodes in the tree.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the maximum number of nodes.
     */
    public int capacity() {
        return pool.length;
    }

    /**
     * Returns a counter that changes whenever the tree order changes. Iterators use it to fail
     * fast.
     */
    public int modCount() {
        return modCount;
    }

    /**
     * Checks the binary search tree order, the red-black properties, the parent links and the
     * node count.
     *
     * @throws AssertionError if any of them is violated
     */
    public void verifyIntegrity() {
        if (root.red) {
            throw new AssertionError("root is red");
        }
        if (root != nil && root.parent != nil) {
            throw new AssertionError("root has a parent");
        }
        int[] count = new int[1];
        blackHeight(root, count);
        if (count[0] != size) {
            throw new AssertionError("tree holds " + count[0] + " nodes but size is " + size);
        }
        if (size + freeCount != pool.length) {
            throw new AssertionError("node pool leaked: size=" + size + ", free=" + freeCount);
        }
        Node prev = null;
        for (Node n = first(); n != null; n = next(n)) {
            if (prev != null && compare(prev.metric, prev.slot, n.metric, n.slot) >= 0) {
                throw new AssertionError("order violated between " + prev + " and " + n);
            }
            prev = n;
        }
    }

    private int blackHeight(Node node, int[] count) {
        if (node == nil) {
            return 1;
        }
        count[0]++;
        if (node.left != nil && node.left.parent != node) {
            throw new AssertionError("broken parent link below " + node);
        }
        if (node.right != nil && node.right.parent != node) {
            throw new AssertionError("broken parent link below " + node);
        }
        if (node.red && (node.left.red || node.right.red)) {
            throw new AssertionError("red node " + node + " has a red child");
        }
        int left = blackHeight(node.left, count);
        int right = blackHeight(node.right, count);
        if (left != right) {
            throw new AssertionError("black height differs below " + node);
        }
        return left + (node.red ? 0 : 1);
    }

    static int compare(long metricA, int slotA, long metricB, int slotB) {
        int c = Long.compare(metricA, metricB);
        return c != 0 ? c : Integer.compare(slotA, slotB);
    }

    private void resetPool() {
        System.arraycopy(pool, 0, free, 0, pool.length);
        freeCount = pool.length;
    }

    private Node minimum(Node node) {
        while (node.left != nil) {
            node = node.left;
        }
        return node;
    }

    private Node maximum(Node node) {
        while (node.right != nil) {
            node = node.right;
        }
        return node;
    }

    private void link(Node z) {
        Node y = nil;
        Node x = root;
        while (x != nil) {
            y = x;
            x = compare(z.metric, z.slot, x.metric, x.slot) < 0 ? x.left : x.right;
        }
        z.parent = y;
        if (y == nil) {
            root = z;
        } else if (compare(z.metric, z.slot, y.metric, y.slot) < 0) {
            y.left = z;
        } else {
            y.right = z;
        }
        z.left = nil;
        z.right = nil;
        z.red = true;
        fixAfterInsertion(z);
    }

    private void fixAfterInsertion(Node z) {
        while (z.parent.red) {
            Node grandparent = z.parent.parent;
            if (z.parent == grandparent.left) {
                Node uncle = grandparent.right;
                if (uncle.red) {
                    z.parent.red = false;
                    uncle.red = false;
                    grandparent.red = true;
                    z = grandparent;
                } else {
                    if (z == z.parent.right) {
                        z = z.parent;
                        rotateLeft(z);
                    }
                    z.parent.red = false;
                    z.parent.parent.red = true;
                    rotateRight(z.parent.parent);
                }
            } else {
                Node uncle = grandparent.left;
                if (uncle.red) {
                    z.parent.red = false;
                    uncle.red = false;
                    grandparent.red = true;
                    z = grandparent;
                } else {
                    if (z == z.parent.left) {
                        z = z.parent;
                        rotateRight(z);
                    }
                    z.parent.red = false;
                    z.parent.parent.red = true;
                    rotateLeft(z.parent.parent);
                }
            }
        }
        root.red = false;
    }

    // Structural delete: the successor is moved into place instead of copying its key, so node
    // references held elsewhere stay valid.
    private void unlink(Node z) {
        Node y = z;
        boolean removedRed = y.red;
        Node x;
        if (z.left == nil) {
            x = z.right;
            transplant(z, z.right);
        } else if (z.right == nil) {
            x = z.left;
            transplant(z, z.left);
        } else {
            y = minimum(z.right);
            removedRed = y.red;
            x = y.right;
            if (y.parent == z) {
                x.parent = y;
            } else {
                transplant(y, y.right);
                y.right = z.right;
                y.right.parent = y;
            }
            transplant(z, y);
            y.left = z.left;
            y.left.parent = y;
            y.red = z.red;
        }
        if (!removedRed) {
            fixAfterDeletion(x);
        }
        nil.parent = nil;
    }

    private void fixAfterDeletion(Node x) {
        while (x != root && !x.red) {
            if (x == x.parent.left) {
                Node w = x.parent.right;
                if (w.red) {
                    w.red = false;
                    x.parent.red = true;
                    rotateLeft(x.parent);
                    w = x.parent.right;
                }
                if (!w.left.red && !w.right.red) {
                    w.red = true;
                    x = x.parent;
                } else {
                    if (!w.right.red) {
                        w.left.red = false;
                        w.red = true;
                        rotateRight(w);
                        w = x.parent.right;
                    }
                    w.red = x.parent.red;
                    x.parent.red = false;
                    w.right.red = false;
                    rotateLeft(x.parent);
                    x = root;
                }
            } else {
                Node w = x.parent.left;
                if (w.red) {
                    w.red = false;
                    x.parent.red = true;
                    rotateRight(x.parent);
                    w = x.parent.left;
                }
                if (!w.right.red && !w.left.red) {
                    w.red = true;
                    x = x.parent;
                } else {
                    if (!w.left.red) {
                        w.right.red = false;
                        w.red = true;
                        rotateLeft(w);
                        w = x.parent.left;
                    }
                    w.red = x.parent.red;
                    x.parent.red = false;
                    w.left.red = false;
                    rotateRight(x.parent);
                    x = root;
                }
            }
        }
        x.red = false;
    }

    private void transplant(Node u, Node v) {
        if (u.parent == nil) {
            root = v;
        } else if (u == u.parent.left) {
            u.parent.left = v;
        } else {
            u.parent.right = v;
        }
        v.parent = u.parent;
    }

    private void rotateLeft(Node x) {
        Node y = x.right;
        x.right = y.left;
        if (y.left != nil) {
            y.left.parent = x;
        }
        y.parent = x.parent;
        if (x.parent == nil) {
            root = y;
        } else if (x == x.parent.left) {
            x.parent.left = y;
        } else {
            x.parent.right = y;
        }
        y.left = x;
        x.parent = y;
    }

    private void rotateRight(Node x) {
        Node y = x.left;
        x.left = y.right;
        if (y.right != nil) {
            y.right.parent = x;
        }
        y.parent = x.parent;
        if (x.parent == nil) {
            root = y;
        } else if (x == x.parent.right) {
            x.parent.right = y;
        } else {
            x.parent.left = y;
        }
        y.right = x;
        x.parent = y;
    }
}
