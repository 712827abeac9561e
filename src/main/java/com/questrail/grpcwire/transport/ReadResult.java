package com.questrail.grpcwire.transport;

import com.questrail.grpcwire.buffer.ByteSequence;

import java.util.Objects;

/**
 * Outcome of one {@link ByteSource#read()}.
 *
 * @param buffer    all buffered, unconsumed bytes (possibly empty)
 * @param cancelled the read was cancelled before new data arrived
 * @param completed the transport will deliver no more bytes after {@code buffer}
 */
public record ReadResult(ByteSequence buffer, boolean cancelled, boolean completed)
{
    public ReadResult {
        Objects.requireNonNull(buffer, "buffer");
    }
}
