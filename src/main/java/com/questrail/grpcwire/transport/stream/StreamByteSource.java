package com.questrail.grpcwire.transport.stream;

import com.questrail.grpcwire.buffer.ByteArrayPool;
import com.questrail.grpcwire.buffer.ByteSequence;
import com.questrail.grpcwire.config.GrpcFramingConfig;
import com.questrail.grpcwire.transport.ByteSource;
import com.questrail.grpcwire.transport.ReadResult;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * StreamByteSource
 * =============================================================================
 * {@link ByteSource} backed by a blocking {@link InputStream}.
 *
 * <p>Inbound bytes are kept in arrays rented from a {@link ByteArrayPool}.
 * Arrays go back to the pool as soon as every byte they hold has been
 * consumed. Unconsumed bytes are never copied between reads.</p>
 *
 * <h2>Cancellation</h2>
 * {@link #cancelPendingRead()} is honoured before each blocking stream read. A
 * thread already blocked inside {@link InputStream#read(byte[], int, int)}
 * observes it only when that call returns, unless the stream itself reacts to
 * interruption with an {@link InterruptedIOException}. A
 * {@link SocketTimeoutException} is not a cancellation and is rethrown.
 */
public final class StreamByteSource implements ByteSource, Closeable
{
    private final InputStream in;
    private final ByteArrayPool pool;
    private final int segmentSize;

    private final Deque<Segment> segments = new ArrayDeque<>();
    private long buffered;
    private long examined;
    private boolean completed;
    private boolean readPending;

    private volatile boolean cancelRequested;

    public StreamByteSource(InputStream in, ByteArrayPool pool, int segmentSize)
    {
        this.in = Objects.requireNonNull(in, "in");
        this.pool = Objects.requireNonNull(pool, "pool");
        if (segmentSize <= 0) {
            throw new IllegalArgumentException("segmentSize must be positive: " + segmentSize);
        }
        this.segmentSize = segmentSize;
    }

    public StreamByteSource(InputStream in, ByteArrayPool pool, GrpcFramingConfig config)
    {
        this(in, pool, Objects.requireNonNull(config, "config").segmentSize());
    }

    /**
     * Unpooled source using the default segment size.
     */
    public StreamByteSource(InputStream in)
    {
        this(in, ByteArrayPool.unpooled(), GrpcFramingConfig.DEFAULT_SEGMENT_SIZE);
    }

    @Override
    public ReadResult read() throws IOException
    {
        if (readPending) {
            throw new IllegalStateException("advanceTo must be called before the next read");
        }

        while (!completed && buffered <= examined) {
            if (cancelRequested) {
                break;
            }
            try {
                fill();
            }
            catch (SocketTimeoutException e) {
                // A read timeout is a transport failure, not an interruption.
                throw e;
            }
            catch (InterruptedIOException e) {
                Thread.currentThread().interrupt();
                cancelRequested = true;
            }
        }

        boolean cancelled = cancelRequested;
        cancelRequested = false;
        readPending = true;
        return new ReadResult(view(), cancelled, completed);
    }

    @Override
    public void advanceTo(long consumed, long examined)
    {
        if (!readPending) {
            throw new IllegalStateException("advanceTo called without a preceding read");
        }
        if (consumed < 0 || consumed > examined || examined > buffered) {
            throw new IllegalArgumentException(
                    "invalid cursors consumed=" + consumed + " examined=" + examined + " buffered=" + buffered);
        }
        readPending = false;

        long remaining = consumed;
        while (remaining > 0) {
            Segment head = segments.peekFirst();
            int available = head.end - head.start;
            if (remaining >= available) {
                segments.removeFirst();
                pool.release(head.array);
                remaining -= available;
            }
            else {
                head.start += (int) remaining;
                remaining = 0;
            }
        }

        this.buffered -= consumed;
        this.examined = examined - consumed;
    }

    @Override
    public void cancelPendingRead()
    {
        cancelRequested = true;
    }

    /**
     * Release every pooled array and close the underlying stream.
     */
    @Override
    public void close() throws IOException
    {
        Segment segment;
        while ((segment = segments.pollFirst()) != null) {
            pool.release(segment.array);
        }
        buffered = 0;
        examined = 0;
        in.close();
    }

    private void fill() throws IOException
    {
        Segment tail = segments.peekLast();
        if (tail == null || tail.end == tail.array.length) {
            tail = new Segment(pool.rent(segmentSize));
            segments.addLast(tail);
        }

        int n = in.read(tail.array, tail.end, tail.array.length - tail.end);
        if (n < 0) {
            completed = true;
            return;
        }
        tail.end += n;
        buffered += n;
    }

    private ByteSequence view()
    {
        if (buffered == 0) {
            return ByteSequence.EMPTY;
        }

        List<ByteBuffer> views = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            views.add(ByteBuffer.wrap(segment.array, segment.start, segment.end - segment.start));
        }
        return ByteSequence.of(views);
    }

    private static final class Segment
    {
        final byte[] array;
        int start;
        int end;

        Segment(byte[] array)
        {
            this.array = array;
        }
    }
}
