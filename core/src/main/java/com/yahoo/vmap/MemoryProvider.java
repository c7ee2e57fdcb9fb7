/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

/**
 * Supplies the backing buffers of the regions. Every region owns exactly one buffer, obtained when the
 * region is created and returned when it is freed.
 */
public interface MemoryProvider {

    // Returns the address of a new buffer of the given size.
    // Throws OutOfBackingMemoryException if the buffer cannot be obtained.
    long allocate(long size);

    // Returns a buffer previously obtained from this provider.
    // IMPORTANT: the size must be the one the buffer was allocated with!
    void release(long address, long size);

    // Number of bytes currently handed out by this provider
    long allocated();
}
