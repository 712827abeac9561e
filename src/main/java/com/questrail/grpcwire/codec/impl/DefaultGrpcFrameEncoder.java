package com.questrail.grpcwire.codec.impl;

import com.questrail.grpcwire.codec.GrpcFrameEncoder;
import com.questrail.grpcwire.config.GrpcFramingConfig;
import com.questrail.grpcwire.observability.FrameEncodedEvent;
import com.questrail.grpcwire.observability.GrpcFramingErrorEvent;
import com.questrail.grpcwire.observability.GrpcFramingObservabilitySink;
import com.questrail.grpcwire.transport.ByteSink;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Objects;

/**
 * DefaultGrpcFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link GrpcFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultGrpcFrameDecoder}. Frames
 * are always written uncompressed. The encoder holds no per-stream state and
 * may be shared.</p>
 */
public final class DefaultGrpcFrameEncoder implements GrpcFrameEncoder
{
    private final GrpcFramingObservabilitySink observability;

    public DefaultGrpcFrameEncoder()
    {
        this(GrpcFramingConfig.defaults());
    }

    public DefaultGrpcFrameEncoder(GrpcFramingConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.observability = config.observabilitySink();
    }

    @Override
    public void writeMessage(ByteSink sink, byte[] payload, boolean flush) throws IOException
    {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(payload, "payload");

        // ---------------------------------------------------------------------
        // 1) Header straight into the sink's reserved region
        // ---------------------------------------------------------------------

        ByteBuffer headerData = sink.reserve(GrpcFrameHeader.HEADER_SIZE);
        GrpcFrameHeader.uncompressed(payload.length).writeTo(headerData);
        sink.commit(GrpcFrameHeader.HEADER_SIZE);

        // ---------------------------------------------------------------------
        // 2) Payload verbatim
        // ---------------------------------------------------------------------

        sink.write(payload);

        // ---------------------------------------------------------------------
        // 3) Optional hand-off to the transport
        // ---------------------------------------------------------------------

        if (flush) {
            try {
                sink.flush();
            }
            catch (IOException e) {
                observability.onError(new GrpcFramingErrorEvent(Instant.now(), "Flush failed after writing message", e));
                throw e;
            }
        }

        observability.onFrameEncoded(new FrameEncodedEvent(Instant.now(), payload.length, flush));
    }

    @Override
    public void writeMessage(OutputStream out, byte[] buffer, int offset, int count) throws IOException
    {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(buffer, "buffer");
        Objects.checkFromIndexSize(offset, count, buffer.length);

        byte[] headerData = new byte[GrpcFrameHeader.HEADER_SIZE];
        GrpcFrameHeader.uncompressed(count).writeTo(ByteBuffer.wrap(headerData));

        out.write(headerData);
        out.write(buffer, offset, count);

        observability.onFrameEncoded(new FrameEncodedEvent(Instant.now(), count, false));
    }

    @Override
    public byte[] encode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        byte[] frame = new byte[GrpcFrameHeader.HEADER_SIZE + payload.length];
        ByteBuffer out = ByteBuffer.wrap(frame);
        GrpcFrameHeader.uncompressed(payload.length).writeTo(out);
        out.put(payload);
        return frame;
    }
}
