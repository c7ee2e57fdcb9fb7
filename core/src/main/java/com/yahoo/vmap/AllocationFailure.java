/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

/**
 * The reasons an allocation request can be refused.
 * None of them leaves the allocator in an unusable state.
 */
public enum AllocationFailure {
    /*
     * The requested size is zero, negative, or overflows when rounded up to a page.
     */
    INVALID_SIZE,

    /*
     * No hole large enough exists inside the configured address space.
     */
    OUT_OF_ADDRESS_SPACE,

    /*
     * The memory provider could not supply the backing buffer.
     */
    OUT_OF_MEMORY
}
