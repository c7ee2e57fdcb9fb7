/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

/**
 * The fixed geometry of one virtual address space: the page size and the half-open range
 * {@code [start, end)} regions are carved from. Instances are immutable and shared between an
 * allocator and its tree.
 */
public final class AddressSpaceConfig {

    public final long pageSize;
    public final long start;
    public final long end;

    private final long pageMask;

    AddressSpaceConfig(long pageSize, long start, long end) {
        if (pageSize <= 0 || Long.bitCount(pageSize) != 1) {
            throw new IllegalArgumentException(
                    String.format("Page size must be a positive power of two (page size: %d).", pageSize));
        }
        this.pageMask = pageSize - 1;
        if (start <= 0) {
            throw new IllegalArgumentException(
                    String.format("Address space must start above the null address (start: 0x%x).", start));
        }
        if (start >= end) {
            throw new IllegalArgumentException(
                    String.format("Address space is empty (start: 0x%x, end: 0x%x).", start, end));
        }
        if ((start & pageMask) != 0 || (end & pageMask) != 0) {
            throw new IllegalArgumentException(
                    String.format("Address space [0x%x, 0x%x) is not aligned to the page size 0x%x.",
                            start, end, pageSize));
        }
        this.pageSize = pageSize;
        this.start = start;
        this.end = end;
    }

    /**
     * Rounds the size up to the next page boundary.
     *
     * @return the aligned size, or -1 if the size is not positive or the rounding overflows
     */
    long alignUp(long size) {
        if (size <= 0 || size > Long.MAX_VALUE - pageMask) {
            return -1;
        }
        return (size + pageMask) & ~pageMask;
    }

    boolean contains(long address) {
        return address >= start && address < end;
    }

    long capacity() {
        return end - start;
    }

    @Override
    public String toString() {
        return String.format("AddressSpaceConfig[page=0x%x, range=[0x%x, 0x%x)]", pageSize, start, end);
    }
}
