/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

import java.util.Arrays;

/**
 * Stores the region records of one tree as a Java long array (on-heap). A record is addressed by its
 * index, and the tree links (parent, left, right) are indices as well.
 *
 * Record's fields:
 * ----------------------------------------------------------------------------------------
 *   0 | START:     first virtual address of the region (inclusive)                        |
 *   1 | END:       last virtual address of the region (exclusive)                         |
 *   2 | PAYLOAD:   address of the backing buffer, owned by the region                     |
 *   3 | PARENT:    index of the parent record, NIL for the root                           |
 *   4 | LEFT:      index of the left child, NIL if none                                   |
 *   5 | RIGHT:     index of the right child, NIL if none                                  |
 *   6 | COLOR:     RED or BLACK                                                           |
 *   7 | MIN_START: smallest START in the subtree rooted here                              |
 *   8 | MAX_END:   largest END in the subtree rooted here                                 |
 *   9 | MAX_GAP:   largest hole between two consecutive regions of the subtree             |
 * ----------------------------------------------------------------------------------------
 *
 * Index 0 is the NIL sentinel. It is always BLACK and is never handed out, so a missing child reads
 * as a BLACK leaf.
 */
class RegionArray {

    static final int START = 0;
    static final int END = 1;
    static final int PAYLOAD = 2;
    static final int PARENT = 3;
    static final int LEFT = 4;
    static final int RIGHT = 5;
    static final int COLOR = 6;
    static final int MIN_START = 7;
    static final int MAX_END = 8;
    static final int MAX_GAP = 9;

    // Number of primitive fields in each record
    static final int FIELD_COUNT = 10;

    static final int NIL = 0;

    static final long RED = 0;
    static final long BLACK = 1;

    static final int DEFAULT_INITIAL_CAPACITY = 64;

    private long[] records;

    // number of records the array can hold before growing, including NIL
    private int capacity;

    // first index never handed out
    private int nextFreshIndex;

    // stack of released indices, reused before fresh ones
    private int[] releasedIndices;
    private int releasedCount;

    RegionArray() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    /**
     * @param initialCapacity how many records to make room for before the first growth
     */
    RegionArray(int initialCapacity) {
        // +1 for the NIL record
        this.capacity = Math.max(2, initialCapacity + 1);
        this.records = new long[capacity * FIELD_COUNT];
        this.releasedIndices = new int[8];
        this.releasedCount = 0;
        this.nextFreshIndex = NIL + 1;
        resetRecord(NIL);
    }

    private static int fieldOffset(int index, int field) {
        return index * FIELD_COUNT + field;
    }

    long get(int index, int field) {
        return records[fieldOffset(index, field)];
    }

    void set(int index, int field, long value) {
        records[fieldOffset(index, field)] = value;
    }

    int getLink(int index, int field) {
        return (int) records[fieldOffset(index, field)];
    }

    void setLink(int index, int field, int link) {
        records[fieldOffset(index, field)] = link;
    }

    long start(int index) {
        return records[fieldOffset(index, START)];
    }

    long end(int index) {
        return records[fieldOffset(index, END)];
    }

    long payload(int index) {
        return records[fieldOffset(index, PAYLOAD)];
    }

    int parent(int index) {
        return getLink(index, PARENT);
    }

    int left(int index) {
        return getLink(index, LEFT);
    }

    int right(int index) {
        return getLink(index, RIGHT);
    }

    boolean isRed(int index) {
        return records[fieldOffset(index, COLOR)] == RED;
    }

    boolean isBlack(int index) {
        return records[fieldOffset(index, COLOR)] == BLACK;
    }

    void setColor(int index, long color) {
        assert index != NIL || color == BLACK : "NIL must stay black";
        records[fieldOffset(index, COLOR)] = color;
    }

    /**
     * Returns a record that is not linked anywhere, colored RED, with its range and payload set.
     * The array grows if all records are in use.
     */
    int allocateIndex(long start, long end, long payload) {
        int index;
        if (releasedCount > 0) {
            index = releasedIndices[--releasedCount];
        } else {
            if (nextFreshIndex == capacity) {
                grow();
            }
            index = nextFreshIndex++;
        }
        resetRecord(index);
        set(index, START, start);
        set(index, END, end);
        set(index, PAYLOAD, payload);
        set(index, MIN_START, start);
        set(index, MAX_END, end);
        set(index, COLOR, RED);
        return index;
    }

    /**
     * Makes the record available for reuse. The caller must have unlinked it from the tree.
     */
    void releaseIndex(int index) {
        assert index != NIL : "NIL cannot be released";
        assert index < nextFreshIndex : String.format("Index %d was never allocated", index);
        if (releasedCount == releasedIndices.length) {
            releasedIndices = Arrays.copyOf(releasedIndices, releasedIndices.length * 2);
        }
        releasedIndices[releasedCount++] = index;
        resetRecord(index);
    }

    /**
     * Brings the array to its initial state with no record in use.
     * Used when emptying the tree without reallocating the array.
     */
    void clear() {
        Arrays.fill(records, 0);
        releasedCount = 0;
        nextFreshIndex = NIL + 1;
        resetRecord(NIL);
    }

    // Number of records currently handed out
    int size() {
        return nextFreshIndex - 1 - releasedCount;
    }

    // used only for testing
    int getCapacity() {
        return capacity - 1;
    }

    private void resetRecord(int index) {
        // all links become NIL
        Arrays.fill(records, fieldOffset(index, 0), fieldOffset(index + 1, 0), 0);
        records[fieldOffset(index, COLOR)] = BLACK;
    }

    private void grow() {
        int newCapacity = capacity * 2;
        if (newCapacity < 0 || (long) newCapacity * FIELD_COUNT > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException(
                    String.format("Region array cannot grow beyond %d records", capacity - 1));
        }
        records = Arrays.copyOf(records, newCapacity * FIELD_COUNT);
        capacity = newCapacity;
    }
}
