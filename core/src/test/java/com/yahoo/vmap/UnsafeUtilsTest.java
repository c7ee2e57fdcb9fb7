/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

import org.junit.Assert;
import org.junit.Test;

public class UnsafeUtilsTest {

    @Test
    public void testCopyToArray() {
        final int sz = 64;
        final byte[] expected = new byte[sz];

        long address = UnsafeUtils.allocateMemory(sz);
        try {
            for (int i = 0; i < sz; i++) {
                expected[i] = (byte) i;
                UnsafeUtils.put(address + i, (byte) i);
            }

            final byte[] result = new byte[sz];
            long copySize = UnsafeUtils.copyToArray(address, result, sz);
            Assert.assertEquals(sz, copySize);
            Assert.assertArrayEquals(expected, result);
        } finally {
            UnsafeUtils.freeMemory(address);
        }
    }

    @Test
    public void testCopyFromArray() {
        final int sz = 64;
        final byte[] expected = new byte[sz];
        for (int i = 0; i < sz; i++) {
            expected[i] = (byte) (sz - i);
        }

        long address = UnsafeUtils.allocateMemory(sz);
        try {
            long copySize = UnsafeUtils.copyFromArray(expected, address, sz);
            Assert.assertEquals(sz, copySize);
            for (int i = 0; i < sz; i++) {
                Assert.assertEquals(expected[i], UnsafeUtils.get(address + i));
            }
        } finally {
            UnsafeUtils.freeMemory(address);
        }
    }

    @Test
    public void testSetMemoryAndWideAccess() {
        long address = UnsafeUtils.allocateMemory(Long.BYTES * 2);
        try {
            UnsafeUtils.setMemory(address, Long.BYTES * 2, (byte) 0);
            Assert.assertEquals(0L, UnsafeUtils.getLong(address));
            Assert.assertEquals(0L, UnsafeUtils.getLong(address + Long.BYTES));

            UnsafeUtils.putLong(address, 0x1122334455667788L);
            UnsafeUtils.putInt(address + Long.BYTES, -7);
            Assert.assertEquals(0x1122334455667788L, UnsafeUtils.getLong(address));
            Assert.assertEquals(-7, UnsafeUtils.getInt(address + Long.BYTES));
        } finally {
            UnsafeUtils.freeMemory(address);
        }
    }
}
