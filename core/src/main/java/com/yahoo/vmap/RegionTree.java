/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

import static com.yahoo.vmap.RegionArray.BLACK;
import static com.yahoo.vmap.RegionArray.COLOR;
import static com.yahoo.vmap.RegionArray.END;
import static com.yahoo.vmap.RegionArray.LEFT;
import static com.yahoo.vmap.RegionArray.MAX_END;
import static com.yahoo.vmap.RegionArray.MAX_GAP;
import static com.yahoo.vmap.RegionArray.MIN_START;
import static com.yahoo.vmap.RegionArray.NIL;
import static com.yahoo.vmap.RegionArray.PARENT;
import static com.yahoo.vmap.RegionArray.PAYLOAD;
import static com.yahoo.vmap.RegionArray.RED;
import static com.yahoo.vmap.RegionArray.RIGHT;
import static com.yahoo.vmap.RegionArray.START;

/**
 * A red-black tree of non-overlapping regions ordered by their start address. The records live in a
 * {@link RegionArray}, so every node is an index and NIL is the always-black sentinel at index 0.
 *
 * Each node also caches the smallest start, the largest end and the largest hole of its subtree.
 * The cache is what lets {@link #findFirstFit(long, long)} skip whole subtrees that cannot hold a request,
 * keeping the search proportional to the tree height.
 *
 * The tree does not check overlaps on insertion, the caller places regions only inside holes.
 * NOT THREAD SAFE !!!
 */
class RegionTree {

    static final long NOT_FOUND = -1;

    private final RegionArray array;
    private int root = NIL;

    RegionTree() {
        this(new RegionArray());
    }

    RegionTree(RegionArray array) {
        this.array = array;
    }

    /*-------------- Accessors --------------*/

    int getRoot() {
        return root;
    }

    boolean isEmpty() {
        return root == NIL;
    }

    int size() {
        return array.size();
    }

    long start(int node) {
        return array.start(node);
    }

    long end(int node) {
        return array.end(node);
    }

    long payload(int node) {
        return array.payload(node);
    }

    // used only for testing
    RegionArray getArray() {
        return array;
    }

    /*-------------- Insertion --------------*/

    /**
     * Creates a record for the region and links it into the tree.
     *
     * @return the index of the new node
     */
    int insert(long start, long end, long payload) {
        assert start < end : String.format("Empty region [0x%x, 0x%x)", start, end);
        int node = array.allocateIndex(start, end, payload);
        insert(node);
        return node;
    }

    /**
     * Links an unlinked record into the tree by its start address, then restores the balance.
     * The caller has verified that the region does not overlap a live one.
     */
    void insert(int node) {
        long key = array.start(node);
        int parent = NIL;
        int x = root;
        while (x != NIL) {
            parent = x;
            assert array.end(node) <= array.start(x) || array.end(x) <= key :
                    String.format("Region [0x%x, 0x%x) overlaps %s", key, array.end(node), nodeString(x));
            x = key < array.start(x) ? array.left(x) : array.right(x);
        }

        array.setLink(node, PARENT, parent);
        array.setLink(node, LEFT, NIL);
        array.setLink(node, RIGHT, NIL);
        array.setColor(node, RED);
        if (parent == NIL) {
            root = node;
        } else if (key < array.start(parent)) {
            array.setLink(parent, LEFT, node);
        } else {
            array.setLink(parent, RIGHT, node);
        }

        updatePath(node);
        insertFixup(node);
    }

    private void insertFixup(int z) {
        // NIL is black, so the loop ends at the latest under the root
        while (array.isRed(array.parent(z))) {
            int p = array.parent(z);
            int g = array.parent(p);
            if (p == array.left(g)) {
                int uncle = array.right(g);
                if (array.isRed(uncle)) {
                    array.setColor(p, BLACK);
                    array.setColor(uncle, BLACK);
                    array.setColor(g, RED);
                    z = g;
                } else {
                    if (z == array.right(p)) {
                        z = p;
                        rotateLeft(z);
                        p = array.parent(z);
                    }
                    array.setColor(p, BLACK);
                    array.setColor(g, RED);
                    rotateRight(g);
                }
            } else {
                int uncle = array.left(g);
                if (array.isRed(uncle)) {
                    array.setColor(p, BLACK);
                    array.setColor(uncle, BLACK);
                    array.setColor(g, RED);
                    z = g;
                } else {
                    if (z == array.left(p)) {
                        z = p;
                        rotateRight(z);
                        p = array.parent(z);
                    }
                    array.setColor(p, BLACK);
                    array.setColor(g, RED);
                    rotateLeft(g);
                }
            }
        }
        array.setColor(root, BLACK);
    }

    /*-------------- Deletion --------------*/

    /**
     * Unlinks the region held by the node and restores the balance.
     * A node with two children takes over the range and payload of its in-order successor, and the
     * successor's record is the one physically unlinked. The returned record is no longer part of the
     * tree but is not released yet.
     *
     * @return the index of the record that was unlinked
     */
    int delete(int z) {
        assert z != NIL;
        int y = z;
        if (array.left(z) != NIL && array.right(z) != NIL) {
            y = successorOf(z);
            array.set(z, START, array.start(y));
            array.set(z, END, array.end(y));
            array.set(z, PAYLOAD, array.payload(y));
        }

        // y has at most one child
        int x = array.left(y) != NIL ? array.left(y) : array.right(y);
        int yParent = array.parent(y);
        boolean removedBlack = array.isBlack(y);
        transplant(y, x);
        updatePath(yParent);

        if (removedBlack) {
            deleteFixup(x);
        }
        array.setLink(NIL, PARENT, NIL);
        return y;
    }

    /**
     * Returns an unlinked record to the array.
     */
    void release(int node) {
        array.releaseIndex(node);
    }

    // Replaces the subtree rooted at u with the one rooted at v. The parent of v is set even if v is NIL,
    // which the delete fix-up relies on.
    private void transplant(int u, int v) {
        int up = array.parent(u);
        if (up == NIL) {
            root = v;
        } else if (u == array.left(up)) {
            array.setLink(up, LEFT, v);
        } else {
            array.setLink(up, RIGHT, v);
        }
        array.setLink(v, PARENT, up);
    }

    private void deleteFixup(int x) {
        while (x != root && array.isBlack(x)) {
            int xp = array.parent(x);
            if (x == array.left(xp)) {
                int w = array.right(xp);
                if (array.isRed(w)) {
                    array.setColor(w, BLACK);
                    array.setColor(xp, RED);
                    rotateLeft(xp);
                    w = array.right(xp);
                }
                if (array.isBlack(array.left(w)) && array.isBlack(array.right(w))) {
                    array.setColor(w, RED);
                    x = xp;
                } else {
                    if (array.isBlack(array.right(w))) {
                        array.setColor(array.left(w), BLACK);
                        array.setColor(w, RED);
                        rotateRight(w);
                        w = array.right(xp);
                    }
                    array.setColor(w, array.get(xp, COLOR));
                    array.setColor(xp, BLACK);
                    array.setColor(array.right(w), BLACK);
                    rotateLeft(xp);
                    x = root;
                }
            } else {
                int w = array.left(xp);
                if (array.isRed(w)) {
                    array.setColor(w, BLACK);
                    array.setColor(xp, RED);
                    rotateRight(xp);
                    w = array.left(xp);
                }
                if (array.isBlack(array.right(w)) && array.isBlack(array.left(w))) {
                    array.setColor(w, RED);
                    x = xp;
                } else {
                    if (array.isBlack(array.left(w))) {
                        array.setColor(array.right(w), BLACK);
                        array.setColor(w, RED);
                        rotateLeft(w);
                        w = array.left(xp);
                    }
                    array.setColor(w, array.get(xp, COLOR));
                    array.setColor(xp, BLACK);
                    array.setColor(array.left(w), BLACK);
                    rotateRight(xp);
                    x = root;
                }
            }
        }
        array.setColor(x, BLACK);
    }

    /*-------------- Rotations --------------*/

    //        x                 y
    //       / \               / \
    //      a   y      ->     x   c
    //         / \           / \
    //        b   c         a   b
    void rotateLeft(int x) {
        int y = array.right(x);
        assert y != NIL;
        int b = array.left(y);
        array.setLink(x, RIGHT, b);
        if (b != NIL) {
            array.setLink(b, PARENT, x);
        }
        replaceChild(array.parent(x), x, y);
        array.setLink(y, LEFT, x);
        array.setLink(x, PARENT, y);
        updateNode(x);
        updateNode(y);
    }

    //          x             y
    //         / \           / \
    //        y   c   ->    a   x
    //       / \               / \
    //      a   b             b   c
    void rotateRight(int x) {
        int y = array.left(x);
        assert y != NIL;
        int b = array.right(y);
        array.setLink(x, LEFT, b);
        if (b != NIL) {
            array.setLink(b, PARENT, x);
        }
        replaceChild(array.parent(x), x, y);
        array.setLink(y, RIGHT, x);
        array.setLink(x, PARENT, y);
        updateNode(x);
        updateNode(y);
    }

    private void replaceChild(int parent, int oldChild, int newChild) {
        array.setLink(newChild, PARENT, parent);
        if (parent == NIL) {
            root = newChild;
        } else if (oldChild == array.left(parent)) {
            array.setLink(parent, LEFT, newChild);
        } else {
            array.setLink(parent, RIGHT, newChild);
        }
    }

    /*-------------- Subtree summaries --------------*/

    // Recomputes the cached summary of a node from its own range and its children's summaries
    private void updateNode(int n) {
        assert n != NIL;
        int l = array.left(n);
        int r = array.right(n);
        long s = array.start(n);
        long e = array.end(n);
        long gap = 0;
        long minStart = s;
        long maxEnd = e;
        if (l != NIL) {
            minStart = array.get(l, MIN_START);
            gap = Math.max(array.get(l, MAX_GAP), s - array.get(l, MAX_END));
        }
        if (r != NIL) {
            maxEnd = array.get(r, MAX_END);
            gap = Math.max(gap, Math.max(array.get(r, MAX_GAP), array.get(r, MIN_START) - e));
        }
        array.set(n, MIN_START, minStart);
        array.set(n, MAX_END, maxEnd);
        array.set(n, MAX_GAP, gap);
    }

    private void updatePath(int n) {
        while (n != NIL) {
            updateNode(n);
            n = array.parent(n);
        }
    }

    /*-------------- Navigation and search --------------*/

    /**
     * Leftmost node of the right subtree. Only called on nodes that have a right child.
     */
    int successorOf(int node) {
        assert array.right(node) != NIL;
        return minimum(array.right(node));
    }

    private int minimum(int node) {
        while (array.left(node) != NIL) {
            node = array.left(node);
        }
        return node;
    }

    // The region with the lowest address, NIL if the tree is empty
    int first() {
        return root == NIL ? NIL : minimum(root);
    }

    // The in-order successor of any node, NIL after the last one
    int next(int node) {
        if (array.right(node) != NIL) {
            return minimum(array.right(node));
        }
        int p = array.parent(node);
        while (p != NIL && node == array.right(p)) {
            node = p;
            p = array.parent(p);
        }
        return p;
    }

    void forEach(RegionVisitor visitor) {
        for (int n = first(); n != NIL; n = next(n)) {
            visitor.visit(array.start(n), array.end(n), array.payload(n));
        }
    }

    /**
     * Reverse lookup of an address.
     *
     * @return the node whose range contains the address, NIL if no live region does
     */
    int findContaining(long address) {
        int x = root;
        while (x != NIL) {
            if (address < array.start(x)) {
                x = array.left(x);
            } else if (address >= array.end(x)) {
                x = array.right(x);
            } else {
                return x;
            }
        }
        return NIL;
    }

    /**
     * First-fit search: walking the regions in address order from {@code lowerBound}, returns the start of
     * the first hole of at least {@code size} bytes. If no hole between regions fits, the end of the last
     * region is returned. All regions must lie at or above {@code lowerBound}.
     * The caller checks the result against the upper bound of its address space.
     */
    long findFirstFit(long size, long lowerBound) {
        assert size > 0;
        long found = firstFit(root, lowerBound, size);
        if (found != NOT_FOUND) {
            return found;
        }
        return root == NIL ? lowerBound : array.get(root, MAX_END);
    }

    // prevEnd is the end of the region just before the subtree (or the lower bound)
    private long firstFit(int x, long prevEnd, long size) {
        if (x == NIL) {
            return NOT_FOUND;
        }
        // a subtree that passes this check always contains a fitting hole
        if (array.get(x, MIN_START) - prevEnd < size && array.get(x, MAX_GAP) < size) {
            return NOT_FOUND;
        }
        int l = array.left(x);
        long found = firstFit(l, prevEnd, size);
        if (found != NOT_FOUND) {
            return found;
        }
        long before = l != NIL ? array.get(l, MAX_END) : prevEnd;
        if (array.start(x) - before >= size) {
            return before;
        }
        return firstFit(array.right(x), array.end(x), size);
    }

    /**
     * The size of the largest hole within {@code [lowerBound, upperBound)}, the edges included.
     */
    long largestGap(long lowerBound, long upperBound) {
        if (root == NIL) {
            return upperBound - lowerBound;
        }
        long edges = Math.max(array.get(root, MIN_START) - lowerBound, upperBound - array.get(root, MAX_END));
        return Math.max(edges, array.get(root, MAX_GAP));
    }

    /**
     * Drops every node. The caller is responsible for the payloads.
     */
    void clear() {
        root = NIL;
        array.clear();
    }

    /*-------------- Validation --------------*/

    /**
     * Checks the ordering, the red-black rules, the parent links and the cached summaries of the whole
     * tree. A violation is a defect and is reported with an {@link AssertionError}.
     *
     * @return the black-height of the tree (NIL leaves counted)
     */
    int validate() {
        if (array.isRed(root)) {
            throw new AssertionError("red root " + nodeString(root));
        }
        if (array.parent(root) != NIL) {
            throw new AssertionError("root has a parent " + nodeString(root));
        }
        if (array.parent(NIL) != NIL || array.isRed(NIL)) {
            throw new AssertionError("NIL sentinel was modified");
        }
        int[] count = new int[1];
        int blackHeight = validate(root, Long.MIN_VALUE, Long.MAX_VALUE, count);
        if (count[0] != array.size()) {
            throw new AssertionError(String.format("tree holds %d nodes but %d records are in use",
                    count[0], array.size()));
        }
        return blackHeight;
    }

    private int validate(int n, long lowerBound, long upperBound, int[] count) {
        if (n == NIL) {
            return 1;
        }
        count[0]++;
        long s = array.start(n);
        long e = array.end(n);
        if (s >= e) {
            throw new AssertionError("empty range " + nodeString(n));
        }
        if (s < lowerBound || e > upperBound) {
            throw new AssertionError("out of order or overlapping " + nodeString(n));
        }
        int l = array.left(n);
        int r = array.right(n);
        if (l != NIL && array.parent(l) != n) {
            throw new AssertionError("left parent " + nodeString(n));
        }
        if (r != NIL && array.parent(r) != n) {
            throw new AssertionError("right parent " + nodeString(n));
        }
        if (array.isRed(n) && (array.isRed(l) || array.isRed(r))) {
            throw new AssertionError("red conflict " + nodeString(n));
        }
        int lh = validate(l, lowerBound, s, count);
        int rh = validate(r, e, upperBound, count);
        if (lh != rh) {
            throw new AssertionError(lh + "<>" + rh + " " + nodeString(n));
        }

        long minStart = array.get(n, MIN_START);
        long maxEnd = array.get(n, MAX_END);
        long maxGap = array.get(n, MAX_GAP);
        updateNode(n);
        if (minStart != array.get(n, MIN_START) || maxEnd != array.get(n, MAX_END)
                || maxGap != array.get(n, MAX_GAP)) {
            throw new AssertionError("stale subtree summary " + nodeString(n));
        }
        return lh + (array.isBlack(n) ? 1 : 0);
    }

    private String nodeString(int n) {
        return String.format("#%d[0x%x, 0x%x)(%s)", n, array.start(n), array.end(n),
                array.isBlack(n) ? "BLACK" : "RED");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        treeString(root, "", sb);
        return sb.toString();
    }

    private void treeString(int n, String prefix, StringBuilder sb) {
        if (n == NIL) {
            return;
        }
        sb.append(prefix).append(nodeString(n)).append('\n');
        treeString(array.left(n), prefix + "  ", sb);
        treeString(array.right(n), prefix + "  ", sb);
    }
}
