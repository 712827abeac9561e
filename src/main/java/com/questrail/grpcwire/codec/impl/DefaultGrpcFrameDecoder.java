package com.questrail.grpcwire.codec.impl;

import com.questrail.grpcwire.buffer.ByteSequence;
import com.questrail.grpcwire.codec.GrpcFrameDecoder;
import com.questrail.grpcwire.codec.GrpcFramingException;
import com.questrail.grpcwire.codec.IncompleteMessageException;
import com.questrail.grpcwire.codec.MessageTooLargeException;
import com.questrail.grpcwire.codec.ReadCancelledException;
import com.questrail.grpcwire.codec.UnsupportedCompressionException;
import com.questrail.grpcwire.config.GrpcFramingConfig;
import com.questrail.grpcwire.frame.GrpcFrame;
import com.questrail.grpcwire.observability.FrameDecodedEvent;
import com.questrail.grpcwire.observability.GrpcFramingErrorEvent;
import com.questrail.grpcwire.observability.GrpcFramingObservabilitySink;
import com.questrail.grpcwire.transport.ByteSource;
import com.questrail.grpcwire.transport.ReadResult;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultGrpcFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link GrpcFrameDecoder}.
 *
 * <p>Each {@link #readMessage(ByteSource, boolean)} call runs a short-lived
 * {@link ReadSession} that loops over {@link ByteSource#read()}, the only point
 * where the calling thread blocks:</p>
 * <ol>
 *   <li>Pull the buffered bytes (blocking until something new is available)</li>
 *   <li>Fail on cancellation</li>
 *   <li>Decode the header once 5 bytes are buffered</li>
 *   <li>Extract the frame once header plus payload are buffered</li>
 *   <li>Decide on completion whether the stream ended cleanly</li>
 * </ol>
 *
 * <p>After every read the source is advanced:</p>
 * <ul>
 *   <li>consumed: past an extracted frame, otherwise not at all</li>
 *   <li>examined: end of buffer when more data is needed; equal to consumed
 *       after a multi-message extraction or a cancellation, so leftover bytes
 *       are offered again without waiting for new data</li>
 * </ul>
 *
 * <p>The decoder itself holds no per-stream state and may be shared between
 * streams; a single source must not be read concurrently.</p>
 */
public final class DefaultGrpcFrameDecoder implements GrpcFrameDecoder
{
    private final int maxInboundMessageSize;
    private final GrpcFramingObservabilitySink observability;

    public DefaultGrpcFrameDecoder()
    {
        this(GrpcFramingConfig.defaults());
    }

    public DefaultGrpcFrameDecoder(GrpcFramingConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.maxInboundMessageSize = config.maxInboundMessageSize();
        this.observability = config.observabilitySink();
    }

    @Override
    public Optional<GrpcFrame> readMessage(ByteSource source, boolean supportMultipleMessages) throws IOException
    {
        Objects.requireNonNull(source, "source");

        ReadSession session = new ReadSession(source, supportMultipleMessages);
        try {
            return session.run();
        }
        catch (GrpcFramingException e) {
            observability.onError(new GrpcFramingErrorEvent(
                    Instant.now(),
                    e.getMessage() + " (state " + session.state + ", reads " + session.reads + ")",
                    e));
            throw e;
        }
    }

    @Override
    public Optional<GrpcFrame> readBufferedMessage(ByteSource source) throws IOException
    {
        Objects.requireNonNull(source, "source");

        ReadResult result = source.read();
        ByteSequence buffer = result.buffer();
        long consumed = 0;
        long examined = buffer.length();

        try {
            if (result.cancelled()) {
                examined = 0;
                throw new ReadCancelledException();
            }

            if (result.completed() && buffer.isEmpty()) {
                observability.onEndOfStream();
                return Optional.empty();
            }

            GrpcFrameHeader header = GrpcFrameHeader.tryRead(buffer).orElseThrow(
                    () -> new IncompleteMessageException("Unable to read the message header."));
            checkReadable(header);

            if (buffer.length() < header.frameLength()) {
                throw new IncompleteMessageException(
                        "Unable to read complete message data. Expected " + header.messageLength() + " bytes.");
            }

            GrpcFrame frame = extract(buffer, header);
            consumed = header.frameLength();
            examined = consumed;

            observability.onFrameDecoded(new FrameDecodedEvent(Instant.now(), frame.length(), true, 1));
            return Optional.of(frame);
        }
        catch (GrpcFramingException e) {
            observability.onError(new GrpcFramingErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
        finally {
            source.advanceTo(consumed, examined);
        }
    }

    private void checkReadable(GrpcFrameHeader header) throws GrpcFramingException
    {
        if (header.compressed()) {
            // No decompressor is available at this layer.
            throw new UnsupportedCompressionException();
        }
        if (header.messageLength() > maxInboundMessageSize) {
            throw new MessageTooLargeException(header.messageLength(), maxInboundMessageSize);
        }
    }

    private static GrpcFrame extract(ByteSequence buffer, GrpcFrameHeader header)
    {
        // Copy out once: the transport may recycle its buffers once advanced.
        byte[] payload = buffer.toArray(GrpcFrameHeader.HEADER_SIZE, header.messageLength());
        return GrpcFrame.adopt(header.compressed(), payload);
    }

    /**
     * Position of a single read call.
     */
    enum State
    {
        AWAITING_HEADER,
        AWAITING_PAYLOAD,
        /** Single-message mode: message held, waiting for the stream to end. */
        AWAITING_STREAM_END,
        DONE
    }

    /**
     * Transient state of one {@link #readMessage(ByteSource, boolean)} call.
     */
    private final class ReadSession
    {
        private final ByteSource source;
        private final boolean multipleMessages;

        private State state = State.AWAITING_HEADER;
        private GrpcFrame completeMessage;
        private int reads;

        ReadSession(ByteSource source, boolean multipleMessages)
        {
            this.source = source;
            this.multipleMessages = multipleMessages;
        }

        Optional<GrpcFrame> run() throws IOException
        {
            while (true) {
                ReadResult result = source.read();
                reads++;

                ByteSequence buffer = result.buffer();
                long consumed = 0;
                long examined = buffer.length();

                try {
                    if (result.cancelled()) {
                        examined = 0;
                        throw new ReadCancelledException();
                    }

                    if (!buffer.isEmpty()) {
                        if (completeMessage != null) {
                            throw new IncompleteMessageException("Additional data after the message received.");
                        }

                        Optional<GrpcFrameHeader> header = GrpcFrameHeader.tryRead(buffer);
                        if (header.isPresent()) {
                            state = State.AWAITING_PAYLOAD;
                            checkReadable(header.get());

                            if (buffer.length() >= header.get().frameLength()) {
                                GrpcFrame frame = extract(buffer, header.get());
                                consumed = header.get().frameLength();

                                if (multipleMessages) {
                                    examined = consumed;
                                    return done(frame);
                                }

                                // Need to verify the stream completes with no additional data.
                                completeMessage = frame;
                                state = State.AWAITING_STREAM_END;
                            }
                        }
                    }

                    if (result.completed()) {
                        return complete(buffer.length() - consumed);
                    }
                }
                finally {
                    source.advanceTo(consumed, examined);
                }
            }
        }

        private Optional<GrpcFrame> complete(long remaining) throws IncompleteMessageException
        {
            if (multipleMessages) {
                if (remaining == 0) {
                    state = State.DONE;
                    observability.onEndOfStream();
                    return Optional.empty();
                }
            }
            else if (completeMessage != null) {
                if (remaining == 0) {
                    return done(completeMessage);
                }
                throw new IncompleteMessageException("Additional data after the message received.");
            }

            throw new IncompleteMessageException("Incomplete message.");
        }

        private Optional<GrpcFrame> done(GrpcFrame frame)
        {
            state = State.DONE;
            observability.onFrameDecoded(new FrameDecodedEvent(Instant.now(), frame.length(), multipleMessages, reads));
            return Optional.of(frame);
        }
    }
}
