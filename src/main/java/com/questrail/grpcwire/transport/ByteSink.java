package com.questrail.grpcwire.transport;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * ByteSink
 * -----------------------------------------------------------------------------
 * Outbound half of a byte-stream transport: an append-only, growable buffer
 * that hands its contents to the transport on {@link #flush()}.
 *
 * <p>Writers obtain a region with {@link #reserve(int)}, fill it from its
 * position, and then {@link #commit(int)} the number of bytes written. Bytes
 * that have been committed but not flushed are not observable by the peer.</p>
 *
 * <p>A sink is owned by a single writer for the duration of a write.</p>
 */
public interface ByteSink
{
    /**
     * Returns a writable region with at least {@code max(sizeHint, 1)} bytes
     * remaining, positioned at zero.
     *
     * <p>The region is only valid until the next call on this sink.</p>
     */
    ByteBuffer reserve(int sizeHint);

    /**
     * Advance the write cursor by {@code count} bytes of the last reserved region.
     */
    void commit(int count);

    /**
     * Hand every committed byte to the transport, blocking until it has been
     * accepted.
     */
    void flush() throws IOException;

    /**
     * Append {@code source[offset, offset + length)} verbatim.
     */
    default void write(byte[] source, int offset, int length)
    {
        Objects.requireNonNull(source, "source");
        Objects.checkFromIndexSize(offset, length, source.length);

        int position = offset;
        int remaining = length;
        while (remaining > 0) {
            // Take whatever room the sink has; never force one region the size of the payload.
            ByteBuffer region = reserve(1);
            int n = Math.min(region.remaining(), remaining);
            region.put(source, position, n);
            commit(n);
            position += n;
            remaining -= n;
        }
    }

    default void write(byte[] source)
    {
        write(source, 0, source.length);
    }
}
