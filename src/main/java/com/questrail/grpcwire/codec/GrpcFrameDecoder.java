package com.questrail.grpcwire.codec;

import com.questrail.grpcwire.frame.GrpcFrame;
import com.questrail.grpcwire.transport.ByteSource;

import java.io.IOException;
import java.util.Optional;

/**
 * GrpcFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for gRPC length-prefixed message framing.
 *
 * <p>This interface defines the inbound boundary between a byte-stream
 * {@link ByteSource} (arbitrarily chunked by the transport) and
 * {@link GrpcFrame}s.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Pulling as many chunks as a frame needs</li>
 *   <li>Validating the frame header</li>
 *   <li>Copying the payload out of the transport's buffers</li>
 *   <li>Leaving the source positioned right after the frame</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Interpreting payloads</li>
 *   <li>Decompression</li>
 *   <li>Retrying failed reads</li>
 * </ul>
 */
public interface GrpcFrameDecoder
{
    /**
     * Read exactly one message from {@code source}.
     *
     * <p>When {@code supportMultipleMessages} is {@code false}, a complete
     * message must be read and the source must then complete with no further
     * data. When {@code true}, a complete message is returned as soon as it is
     * buffered and the source may hold or receive more data for later calls.</p>
     *
     * @return the decoded frame; {@link Optional#empty()} only in multi-message
     *         mode, when the source completed with nothing left to read
     * @throws IncompleteMessageException     the source ended mid-frame, or data
     *                                        followed a single message
     * @throws UnsupportedCompressionException a compressed frame was received
     * @throws CorruptFrameException          the compression flag is invalid
     * @throws MessageTooLargeException       the declared length is above the limit
     * @throws ReadCancelledException         the read was cancelled
     * @throws IOException                    the transport failed
     */
    Optional<GrpcFrame> readMessage(ByteSource source, boolean supportMultipleMessages) throws IOException;

    /**
     * Read one message that must already be fully buffered by {@code source},
     * without waiting for further data.
     *
     * @return the decoded frame, or {@link Optional#empty()} if the source has
     *         completed
     */
    Optional<GrpcFrame> readBufferedMessage(ByteSource source) throws IOException;
}
