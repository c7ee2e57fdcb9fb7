/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

/**
 * Receives the live regions of a tree in ascending address order.
 */
@FunctionalInterface
interface RegionVisitor {
    void visit(long start, long end, long payload);
}
