package com.questrail.grpcwire.buffer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class BoundedByteArrayPoolTest
{
    @Test
    void releasedArraysAreReused()
    {
        BoundedByteArrayPool pool = new BoundedByteArrayPool(16, 2);

        byte[] first = pool.rent(10);
        assertEquals(16, first.length);

        pool.release(first);
        assertEquals(1, pool.idleCount());
        assertSame(first, pool.rent(16));
        assertEquals(0, pool.idleCount());
    }

    @Test
    void retainsAtMostCapacity()
    {
        BoundedByteArrayPool pool = new BoundedByteArrayPool(8, 2);

        pool.release(pool.rent(8));
        pool.release(new byte[8]);
        pool.release(new byte[8]);

        assertEquals(2, pool.idleCount());
    }

    /**
     * Verifies that oversized requests bypass the pool entirely.
     */
    @Test
    void oversizedArraysAreNotRetained()
    {
        BoundedByteArrayPool pool = new BoundedByteArrayPool(8, 4);

        byte[] large = pool.rent(100);
        assertEquals(100, large.length);

        pool.release(large);
        assertEquals(0, pool.idleCount());
    }

    @Test
    void rejectsInvalidArguments()
    {
        assertThrows(IllegalArgumentException.class, () -> new BoundedByteArrayPool(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new BoundedByteArrayPool(8, -1));
        assertThrows(IllegalArgumentException.class, () -> new BoundedByteArrayPool(8, 1).rent(-1));
    }

    @Test
    void unpooledAllocatesExactLength()
    {
        ByteArrayPool pool = ByteArrayPool.unpooled();

        assertEquals(3, pool.rent(3).length);
        pool.release(new byte[3]);
    }
}
