/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

import java.io.Closeable;

/**
 * Hands out non-overlapping, page-aligned ranges of a bounded virtual address space, each backed by its own
 * buffer, and takes them back on free. Ranges are placed first-fit: the lowest hole that is large enough wins.
 * Use {@link RegionAllocatorBuilder} to create instances.
 */
public interface RegionAllocator extends Closeable {

    // Never the address of a region; freeing it is a no-op
    long NULL_ADDRESS = 0;

    /**
     * Allocates a region of at least the given size, rounded up to whole pages.
     *
     * @param size the requested number of bytes
     * @return the virtual start address of the new region
     * @throws AllocationException if the size is invalid, no hole is large enough, or the backing buffer
     *                             cannot be obtained. The allocator is unchanged in all these cases.
     */
    long allocate(long size) throws AllocationException;

    /**
     * Frees the region that contains the given address, together with its backing buffer.
     * Freeing {@link #NULL_ADDRESS} does nothing.
     *
     * @throws InvalidFreeException if no live region contains the address, including when it was
     *                              already freed
     */
    void free(long address) throws InvalidFreeException;

    /**
     * Translates a virtual address of a live region to the address of the same byte in its backing buffer.
     * The result can be used with {@link UnsafeUtils} accessors until the region is freed.
     *
     * @throws IllegalArgumentException if no live region contains the address
     */
    long resolve(long address);

    // Number of bytes covered by live regions
    long allocated();

    // Number of live regions
    int regionCount();

    // Size of the largest request that would currently succeed as far as the address space is concerned
    long largestAvailable();

    AddressSpaceConfig getConfig();

    // Releases every live region and its buffer. Further calls on this allocator fail.
    @Override
    void close();

    boolean isClosed();
}
