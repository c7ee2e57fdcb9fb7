/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The region allocator over a {@link RegionTree}. The tree is both the index of live regions and, through
 * the holes between them, the free space.
 * NOT THREAD SAFE !!! Wrap it with {@link SynchronizedRegionAllocator} for concurrent callers.
 */
class TreeRegionAllocator implements RegionAllocator {

    private static final Logger LOG = Logger.getLogger(TreeRegionAllocator.class.getName());

    private final AddressSpaceConfig config;
    private final MemoryProvider memoryProvider;
    private final RegionTree tree;

    // number of bytes covered by live regions
    // can be calculated, but kept for easy access
    private long allocated = 0;

    // flag allowing not to close the same allocator twice
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Stats stats = null;

    TreeRegionAllocator(AddressSpaceConfig config, MemoryProvider memoryProvider) {
        this(config, memoryProvider, new RegionTree());
    }

    // A testable constructor
    TreeRegionAllocator(AddressSpaceConfig config, MemoryProvider memoryProvider, RegionTree tree) {
        this.config = config;
        this.memoryProvider = memoryProvider;
        this.tree = tree;
    }

    @Override
    public long allocate(long size) throws AllocationException {
        checkNotClosed();
        long alignedSize = config.alignUp(size);
        if (alignedSize < 0) {
            throw fail(AllocationFailure.INVALID_SIZE,
                    String.format("Cannot allocate a region of %d bytes", size), null);
        }

        long candidate = tree.findFirstFit(alignedSize, config.start);
        if (alignedSize > config.end - candidate) {
            throw fail(AllocationFailure.OUT_OF_ADDRESS_SPACE,
                    String.format("No hole of 0x%x bytes in %s (largest: 0x%x)",
                            alignedSize, config, largestAvailable()), null);
        }

        long payload;
        try {
            payload = memoryProvider.allocate(alignedSize);
        } catch (OutOfBackingMemoryException e) {
            LOG.warning(String.format("No backing memory for a region of 0x%x bytes: %s",
                    alignedSize, e.getMessage()));
            throw fail(AllocationFailure.OUT_OF_MEMORY,
                    String.format("Cannot obtain a backing buffer of 0x%x bytes", alignedSize), e);
        }

        try {
            tree.insert(candidate, candidate + alignedSize, payload);
        } catch (RuntimeException e) {
            memoryProvider.release(payload, alignedSize);
            throw e;
        }
        allocated += alignedSize;
        if (stats != null) {
            stats.allocate(alignedSize);
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("Allocated [0x%x, 0x%x) for a request of %d bytes",
                    candidate, candidate + alignedSize, size));
        }
        return candidate;
    }

    @Override
    public void free(long address) throws InvalidFreeException {
        checkNotClosed();
        if (address == NULL_ADDRESS) {
            return;
        }
        int node = tree.findContaining(address);
        if (node == RegionArray.NIL) {
            if (stats != null) {
                stats.invalidFree();
            }
            LOG.warning(String.format("Invalid address 0x%x: cannot free", address));
            throw new InvalidFreeException(address);
        }

        long start = tree.start(node);
        long size = tree.end(node) - start;
        memoryProvider.release(tree.payload(node), size);
        int unlinked = tree.delete(node);
        tree.release(unlinked);

        allocated -= size;
        if (stats != null) {
            stats.release(size);
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("Freed [0x%x, 0x%x)", start, start + size));
        }
    }

    @Override
    public long resolve(long address) {
        checkNotClosed();
        int node = tree.findContaining(address);
        if (node == RegionArray.NIL) {
            throw new IllegalArgumentException(String.format("Address 0x%x is not mapped", address));
        }
        return tree.payload(node) + (address - tree.start(node));
    }

    @Override
    public long allocated() {
        return allocated;
    }

    @Override
    public int regionCount() {
        return tree.size();
    }

    @Override
    public long largestAvailable() {
        return tree.largestGap(config.start, config.end);
    }

    @Override
    public AddressSpaceConfig getConfig() {
        return config;
    }

    // Releases all the backing buffers. Not thread safe, should be a single thread call.
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int live = tree.size();
        if (live > 0) {
            LOG.info(String.format("Closing an allocator with %d live regions (0x%x bytes)", live, allocated));
        }
        tree.forEach((start, end, payload) -> memoryProvider.release(payload, end - start));
        tree.clear();
        allocated = 0;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("The allocator was already closed");
        }
    }

    private AllocationException fail(AllocationFailure failure, String message, Throwable cause) {
        if (stats != null) {
            stats.fail(failure);
        }
        return new AllocationException(failure, message, cause);
    }

    // used only for testing
    RegionTree getTree() {
        return tree;
    }

    public void collectStats() {
        stats = new Stats();
    }

    public Stats getStats() {
        return stats;
    }

    static class Stats {
        int allocatedRegions;
        int releasedRegions;
        long allocatedBytes;
        long releasedBytes;
        int invalidFrees;
        final int[] failures = new int[AllocationFailure.values().length];

        void allocate(long size) {
            allocatedRegions++;
            allocatedBytes += size;
        }

        void release(long size) {
            releasedRegions++;
            releasedBytes += size;
        }

        void fail(AllocationFailure failure) {
            failures[failure.ordinal()]++;
        }

        void invalidFree() {
            invalidFrees++;
        }

        int failures(AllocationFailure failure) {
            return failures[failure.ordinal()];
        }
    }
}
