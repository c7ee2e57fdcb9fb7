/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

import sun.misc.Unsafe;

import java.lang.reflect.Constructor;

/**
 * Raw access to the off-heap memory backing the allocated regions.
 * Addresses given to the accessors are the ones returned by {@link RegionAllocator#resolve(long)}.
 */
public final class UnsafeUtils {

    static final Unsafe UNSAFE;
    static final long BYTE_ARRAY_OFFSET;

    // static constructor - access and create a new instance of Unsafe
    static {
        try {
            Constructor<Unsafe> unsafeConstructor = Unsafe.class.getDeclaredConstructor();
            unsafeConstructor.setAccessible(true);
            UNSAFE = unsafeConstructor.newInstance();
            BYTE_ARRAY_OFFSET = UNSAFE.arrayBaseOffset(byte[].class);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    private UnsafeUtils() {
    }

    // May throw OutOfMemoryError if the native allocation is refused
    static long allocateMemory(long capacity) {
        return UNSAFE.allocateMemory(capacity);
    }

    static void freeMemory(long address) {
        UNSAFE.freeMemory(address);
    }

    public static void setMemory(long address, long bytes, byte value) {
        UNSAFE.setMemory(address, bytes, value);
    }

    public static byte get(long address) {
        return UNSAFE.getByte(address);
    }

    public static int getInt(long address) {
        return UNSAFE.getInt(address);
    }

    public static long getLong(long address) {
        return UNSAFE.getLong(address);
    }

    public static void put(long address, byte value) {
        UNSAFE.putByte(address, value);
    }

    public static void putInt(long address, int value) {
        UNSAFE.putInt(address, value);
    }

    public static void putLong(long address, long value) {
        UNSAFE.putLong(address, value);
    }

    /**
     * Copies {@code length} bytes starting at the given off-heap address into the array.
     *
     * @return the number of bytes copied
     */
    public static long copyToArray(long address, byte[] array, int length) {
        UNSAFE.copyMemory(null, address, array, BYTE_ARRAY_OFFSET, length);
        return length;
    }

    /**
     * Copies {@code length} bytes of the array to the given off-heap address.
     *
     * @return the number of bytes copied
     */
    public static long copyFromArray(byte[] array, long address, int length) {
        UNSAFE.copyMemory(array, BYTE_ARRAY_OFFSET, null, address, length);
        return length;
    }
}
