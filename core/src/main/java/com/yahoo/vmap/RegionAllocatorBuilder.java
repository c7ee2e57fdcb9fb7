/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

/**
 * This class builds a new RegionAllocator instance over one virtual address space. The geometry is fixed
 * at construction and cannot be changed afterwards.
 */
public class RegionAllocatorBuilder {

    static final long DEFAULT_PAGE_SIZE = 4096;
    static final long DEFAULT_ADDRESS_SPACE_START = 0x10000000L;
    static final long DEFAULT_ADDRESS_SPACE_END = 0x7FFFF000L;

    // 1GB of backing memory by default
    static final long DEFAULT_MEMORY_CAPACITY = 1L << 30;

    private long pageSize;
    private long addressSpaceStart;
    private long addressSpaceEnd;

    // Backing memory fields
    private long memoryCapacity;
    private MemoryProvider memoryProvider;

    private boolean threadSafe;
    private int initialRegionCapacity;

    public RegionAllocatorBuilder() {
        this.pageSize = DEFAULT_PAGE_SIZE;
        this.addressSpaceStart = DEFAULT_ADDRESS_SPACE_START;
        this.addressSpaceEnd = DEFAULT_ADDRESS_SPACE_END;
        this.memoryCapacity = DEFAULT_MEMORY_CAPACITY;
        this.memoryProvider = null;
        this.threadSafe = false;
        this.initialRegionCapacity = RegionArray.DEFAULT_INITIAL_CAPACITY;
    }

    public RegionAllocatorBuilder setPageSize(long pageSize) {
        this.pageSize = pageSize;
        return this;
    }

    public RegionAllocatorBuilder setAddressSpaceStart(long addressSpaceStart) {
        this.addressSpaceStart = addressSpaceStart;
        return this;
    }

    public RegionAllocatorBuilder setAddressSpaceEnd(long addressSpaceEnd) {
        this.addressSpaceEnd = addressSpaceEnd;
        return this;
    }

    public RegionAllocatorBuilder setAddressSpace(long start, long end) {
        this.addressSpaceStart = start;
        this.addressSpaceEnd = end;
        return this;
    }

    /**
     * Bounds the backing memory of the default native provider.
     * Ignored when a provider is given with {@link #setMemoryProvider(MemoryProvider)}.
     */
    public RegionAllocatorBuilder setMemoryCapacity(long memoryCapacity) {
        this.memoryCapacity = memoryCapacity;
        return this;
    }

    public RegionAllocatorBuilder setMemoryProvider(MemoryProvider memoryProvider) {
        this.memoryProvider = memoryProvider;
        return this;
    }

    /**
     * Serializes every operation on one lock, for allocators shared between threads.
     */
    public RegionAllocatorBuilder setThreadSafe(boolean threadSafe) {
        this.threadSafe = threadSafe;
        return this;
    }

    public RegionAllocatorBuilder setInitialRegionCapacity(int initialRegionCapacity) {
        this.initialRegionCapacity = initialRegionCapacity;
        return this;
    }

    private void checkPreconditions() {
        if (initialRegionCapacity <= 0) {
            throw new IllegalArgumentException(
                    String.format("Initial region capacity must be positive (capacity: %d).",
                            initialRegionCapacity));
        }
        if (memoryProvider == null && memoryCapacity <= 0) {
            throw new IllegalArgumentException(
                    String.format("Backing memory capacity must be positive (capacity: %d).", memoryCapacity));
        }
    }

    public RegionAllocator build() {
        checkPreconditions();
        AddressSpaceConfig config = new AddressSpaceConfig(pageSize, addressSpaceStart, addressSpaceEnd);
        MemoryProvider provider = memoryProvider != null ? memoryProvider : new NativeMemoryProvider(memoryCapacity);
        RegionAllocator allocator = new TreeRegionAllocator(config, provider,
                new RegionTree(new RegionArray(initialRegionCapacity)));
        return threadSafe ? new SynchronizedRegionAllocator(allocator) : allocator;
    }
}
