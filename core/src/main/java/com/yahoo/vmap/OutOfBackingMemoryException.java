/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

/**
 * Thrown by a {@link MemoryProvider} when it cannot supply a backing buffer.
 */
public class OutOfBackingMemoryException extends RuntimeException {

    public OutOfBackingMemoryException(String message) {
        super(message);
    }

    public OutOfBackingMemoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
