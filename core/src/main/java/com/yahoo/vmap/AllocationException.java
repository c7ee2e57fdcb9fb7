/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

/**
 * Thrown when {@link RegionAllocator#allocate(long)} cannot satisfy a request.
 * The tree is unchanged when this is thrown, so the caller may free other regions and retry.
 */
public class AllocationException extends Exception {

    private final AllocationFailure failure;

    public AllocationException(AllocationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public AllocationException(AllocationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public AllocationFailure getFailure() {
        return failure;
    }
}
