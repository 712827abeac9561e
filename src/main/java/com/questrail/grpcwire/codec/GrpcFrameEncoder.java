package com.questrail.grpcwire.codec;

import com.questrail.grpcwire.transport.ByteSink;

import java.io.IOException;
import java.io.OutputStream;

/**
 * GrpcFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for gRPC length-prefixed message framing.
 *
 * <p>This interface defines the outbound boundary between an opaque message
 * payload and the bytes written to a transport. It only applies the mechanical
 * rules of the 5-byte header (compression flag + big-endian length); it never
 * decides what to send and never compresses.</p>
 *
 * <p>Payload length must already satisfy the {@code 2^31 - 1} limit; message
 * size limits are enforced by the caller.</p>
 */
public interface GrpcFrameEncoder
{
    /**
     * Append one frame carrying {@code payload} to {@code sink}.
     *
     * @param flush if {@code true}, block until the sink has handed its buffered
     *              bytes to the transport; otherwise the frame may stay buffered
     * @throws IOException if flushing the sink fails
     */
    void writeMessage(ByteSink sink, byte[] payload, boolean flush) throws IOException;

    /**
     * Write one frame carrying {@code buffer[offset, offset + count)} directly
     * to {@code out}. The stream is not flushed.
     */
    void writeMessage(OutputStream out, byte[] buffer, int offset, int count) throws IOException;

    /**
     * Encode {@code payload} into a new wire-ready array (header followed by payload).
     */
    byte[] encode(byte[] payload);
}
