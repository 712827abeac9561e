package com.questrail.grpcwire.buffer;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * BoundedByteArrayPool
 * -----------------------------------------------------------------------------
 * Thread-safe pool of equally sized arrays, retaining at most {@code capacity}
 * idle arrays.
 *
 * <p>Requests larger than the pooled array size are served by plain
 * allocation and are dropped on release, so oversized frames never pin memory
 * in the pool.</p>
 */
public final class BoundedByteArrayPool implements ByteArrayPool
{
    private final int arraySize;
    private final int capacity;
    private final Deque<byte[]> idle = new ArrayDeque<>();

    public BoundedByteArrayPool(int arraySize, int capacity)
    {
        if (arraySize <= 0) {
            throw new IllegalArgumentException("arraySize must be positive: " + arraySize);
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.arraySize = arraySize;
        this.capacity = capacity;
    }

    @Override
    public byte[] rent(int minimumLength)
    {
        if (minimumLength < 0) {
            throw new IllegalArgumentException("minimumLength must not be negative: " + minimumLength);
        }
        if (minimumLength > arraySize) {
            return new byte[minimumLength];
        }

        synchronized (idle) {
            byte[] pooled = idle.pollFirst();
            if (pooled != null) {
                return pooled;
            }
        }
        return new byte[arraySize];
    }

    @Override
    public void release(byte[] array)
    {
        if (array == null || array.length != arraySize) {
            return;
        }

        synchronized (idle) {
            if (idle.size() < capacity) {
                idle.addFirst(array);
            }
        }
    }

    public int arraySize()
    {
        return arraySize;
    }

    /**
     * Number of arrays currently parked in the pool.
     */
    public int idleCount()
    {
        synchronized (idle) {
            return idle.size();
        }
    }
}
