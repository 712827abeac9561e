package com.questrail.grpcwire.transport;

import java.io.IOException;

/**
 * ByteSource
 * -----------------------------------------------------------------------------
 * Inbound half of a byte-stream transport, as seen by the frame decoder.
 *
 * <p>The source keeps every byte it has delivered until the reader declares it
 * consumed. Each {@link #read()} must be followed by exactly one
 * {@link #advanceTo(long, long)} before the next read.</p>
 *
 * <h2>Consumed vs. examined</h2>
 * <ul>
 *   <li><em>consumed</em>: prefix of the last buffer that the reader is done
 *       with; the source may discard it and recycle its memory.</li>
 *   <li><em>examined</em>: prefix the reader has looked at without being able
 *       to make progress. The next {@link #read()} does not return until bytes
 *       beyond this point are available, the stream completes, or the read is
 *       cancelled.</li>
 * </ul>
 *
 * <p>Implementations may be backed by a blocking stream, Netty, or a test
 * script. A source is owned by one reader at a time.</p>
 */
public interface ByteSource
{
    /**
     * Returns the currently buffered, unconsumed bytes, blocking until there is
     * something new to look at.
     *
     * <p>Interruption of the calling thread while blocked is reported as a
     * cancelled result and the interrupt flag is restored.</p>
     *
     * @throws IOException if the underlying transport failed
     */
    ReadResult read() throws IOException;

    /**
     * Mark how much of the buffer returned by the last {@link #read()} was
     * consumed and how much was examined.
     *
     * <p>Both offsets are relative to the start of that buffer and must satisfy
     * {@code 0 <= consumed <= examined <= buffer.length()}.</p>
     */
    void advanceTo(long consumed, long examined);

    /**
     * Cause the pending read, or the next one if none is pending, to return a
     * cancelled result. Safe to call from any thread.
     */
    void cancelPendingRead();
}
