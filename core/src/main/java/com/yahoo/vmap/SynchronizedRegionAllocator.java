/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

/**
 * Makes a {@link RegionAllocator} safe for concurrent callers by holding one lock for the whole of each
 * operation. The hole found by a search and the insertion that fills it happen under the same lock, so two
 * allocations can never be given the same hole.
 */
class SynchronizedRegionAllocator implements RegionAllocator {

    private final RegionAllocator delegate;

    SynchronizedRegionAllocator(RegionAllocator delegate) {
        this.delegate = delegate;
    }

    @Override
    public synchronized long allocate(long size) throws AllocationException {
        return delegate.allocate(size);
    }

    @Override
    public synchronized void free(long address) throws InvalidFreeException {
        delegate.free(address);
    }

    @Override
    public synchronized long resolve(long address) {
        return delegate.resolve(address);
    }

    @Override
    public synchronized long allocated() {
        return delegate.allocated();
    }

    @Override
    public synchronized int regionCount() {
        return delegate.regionCount();
    }

    @Override
    public synchronized long largestAvailable() {
        return delegate.largestAvailable();
    }

    @Override
    public AddressSpaceConfig getConfig() {
        return delegate.getConfig();
    }

    @Override
    public synchronized void close() {
        delegate.close();
    }

    @Override
    public boolean isClosed() {
        return delegate.isClosed();
    }

    // used only for testing
    RegionAllocator getDelegate() {
        return delegate;
    }
}
