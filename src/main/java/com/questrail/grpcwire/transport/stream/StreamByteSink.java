package com.questrail.grpcwire.transport.stream;

import com.questrail.grpcwire.buffer.ByteArrayPool;
import com.questrail.grpcwire.config.GrpcFramingConfig;
import com.questrail.grpcwire.transport.ByteSink;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * StreamByteSink
 * =============================================================================
 * {@link ByteSink} that buffers committed bytes in pooled arrays and writes
 * them to an {@link OutputStream} on {@link #flush()}.
 *
 * <p>Nothing reaches the stream before {@link #flush()}.</p>
 */
public final class StreamByteSink implements ByteSink, Closeable
{
    private final OutputStream out;
    private final ByteArrayPool pool;
    private final int segmentSize;

    private final Deque<Segment> filled = new ArrayDeque<>();
    private Segment current;
    private int reserved;
    private long unflushed;

    public StreamByteSink(OutputStream out, ByteArrayPool pool, int segmentSize)
    {
        this.out = Objects.requireNonNull(out, "out");
        this.pool = Objects.requireNonNull(pool, "pool");
        if (segmentSize <= 0) {
            throw new IllegalArgumentException("segmentSize must be positive: " + segmentSize);
        }
        this.segmentSize = segmentSize;
    }

    public StreamByteSink(OutputStream out, ByteArrayPool pool, GrpcFramingConfig config)
    {
        this(out, pool, Objects.requireNonNull(config, "config").segmentSize());
    }

    /**
     * Unpooled sink using the default segment size.
     */
    public StreamByteSink(OutputStream out)
    {
        this(out, ByteArrayPool.unpooled(), GrpcFramingConfig.DEFAULT_SEGMENT_SIZE);
    }

    @Override
    public ByteBuffer reserve(int sizeHint)
    {
        int needed = Math.max(sizeHint, 1);

        if (current == null || current.array.length - current.length < needed) {
            if (current != null) {
                retireCurrent();
            }
            current = new Segment(pool.rent(Math.max(needed, segmentSize)));
        }

        reserved = current.array.length - current.length;
        return ByteBuffer.wrap(current.array, current.length, reserved).slice();
    }

    @Override
    public void commit(int count)
    {
        if (count < 0 || count > reserved) {
            throw new IllegalArgumentException("commit of " + count + " bytes exceeds reserved " + reserved);
        }
        current.length += count;
        reserved -= count;
        unflushed += count;
    }

    @Override
    public void flush() throws IOException
    {
        if (current != null) {
            retireCurrent();
        }

        Segment segment;
        while ((segment = filled.pollFirst()) != null) {
            try {
                out.write(segment.array, 0, segment.length);
            }
            finally {
                pool.release(segment.array);
            }
            unflushed -= segment.length;
        }

        out.flush();
    }

    /**
     * Bytes committed but not yet handed to the stream.
     */
    public long unflushedBytes()
    {
        return unflushed;
    }

    /**
     * Drop unflushed bytes, return pooled arrays and close the stream.
     */
    @Override
    public void close() throws IOException
    {
        if (current != null) {
            retireCurrent();
        }
        Segment segment;
        while ((segment = filled.pollFirst()) != null) {
            pool.release(segment.array);
        }
        unflushed = 0;
        out.close();
    }

    private void retireCurrent()
    {
        if (current.length > 0) {
            filled.addLast(current);
        }
        else {
            pool.release(current.array);
        }
        current = null;
        reserved = 0;
    }

    private static final class Segment
    {
        final byte[] array;
        int length;

        Segment(byte[] array)
        {
            this.array = array;
        }
    }
}
