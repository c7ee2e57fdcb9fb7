/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Backing buffers taken directly from native memory. The total amount handed out is bounded by a capacity,
 * which makes memory exhaustion a reportable condition instead of a process-wide failure.
 */
class NativeMemoryProvider implements MemoryProvider {

    private static final Logger LOG = Logger.getLogger(NativeMemoryProvider.class.getName());

    // the memory allocation limit for this provider
    private final long capacity;

    // number of bytes handed out and not yet released
    private final AtomicLong allocated = new AtomicLong(0);

    NativeMemoryProvider(long capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException(
                    String.format("Backing memory capacity must be positive (capacity: %d).", capacity));
        }
        this.capacity = capacity;
    }

    @Override
    public long allocate(long size) {
        assert size > 0;
        // reserved before the check, rolled back on failure
        long now = allocated.getAndAdd(size);
        if (size > capacity - now) {
            allocated.addAndGet(-size);
            throw new OutOfBackingMemoryException(
                    String.format("This provider capacity was exceeded (capacity: %d, requested: %d).",
                            capacity, size));
        }
        try {
            return UnsafeUtils.allocateMemory(size);
        } catch (OutOfMemoryError e) {
            allocated.addAndGet(-size);
            LOG.warning(String.format("Native allocation of %d bytes failed: %s", size, e.getMessage()));
            throw new OutOfBackingMemoryException(
                    String.format("Native memory refused an allocation of %d bytes", size), e);
        }
    }

    @Override
    public void release(long address, long size) {
        UnsafeUtils.freeMemory(address);
        allocated.addAndGet(-size);
    }

    @Override
    public long allocated() {
        return allocated.get();
    }

    long getCapacity() {
        return capacity;
    }
}
