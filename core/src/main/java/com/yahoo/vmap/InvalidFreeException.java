/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

/**
 * This Exception is thrown when freeing an address that is not inside any live region,
 * e.g. an address that was never returned by the allocator or one that was already freed.
 */
public class InvalidFreeException extends Exception {

    private final long address;

    public InvalidFreeException(long address) {
        super(String.format("Address 0x%x does not belong to a live region", address));
        this.address = address;
    }

    public long getAddress() {
        return address;
    }
}
