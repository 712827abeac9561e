package com.questrail.grpcwire.codec.impl;

import com.questrail.grpcwire.buffer.BoundedByteArrayPool;
import com.questrail.grpcwire.frame.GrpcFrame;
import com.questrail.grpcwire.transport.stream.StreamByteSink;
import com.questrail.grpcwire.transport.stream.StreamByteSource;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: frames written by the encoder through a stream sink are
 * read back by the decoder through a stream source sharing one array pool.
 */
final class GrpcFrameRoundtripTest
{
    private static final int SEGMENT_SIZE = 32;

    private final DefaultGrpcFrameEncoder encoder = new DefaultGrpcFrameEncoder();
    private final DefaultGrpcFrameDecoder decoder = new DefaultGrpcFrameDecoder();

    @Test
    void messageStreamSurvivesSmallSegments() throws Exception
    {
        BoundedByteArrayPool pool = new BoundedByteArrayPool(SEGMENT_SIZE, 8);
        Random random = new Random(42);

        List<byte[]> messages = new ArrayList<>();
        for (int length : new int[] { 0, 1, 31, 32, 33, 449, 5000 }) {
            byte[] payload = new byte[length];
            random.nextBytes(payload);
            messages.add(payload);
        }

        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        try (StreamByteSink sink = new StreamByteSink(wire, pool, SEGMENT_SIZE)) {
            for (byte[] message : messages) {
                encoder.writeMessage(sink, message, false);
            }
            sink.flush();
        }

        try (StreamByteSource source = new StreamByteSource(new ByteArrayInputStream(wire.toByteArray()), pool, SEGMENT_SIZE)) {
            for (byte[] expected : messages) {
                GrpcFrame frame = decoder.readMessage(source, true).orElseThrow();
                assertArrayEquals(expected, frame.payload());
            }
            assertEquals(Optional.empty(), decoder.readMessage(source, true));
        }

        assertTrue(pool.idleCount() > 0);
        assertTrue(pool.idleCount() <= 8);
    }

    @Test
    void singleLargeMessage() throws Exception
    {
        byte[] payload = new byte[256 * 1024];
        new Random(7).nextBytes(payload);

        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        encoder.writeMessage(new StreamByteSink(wire), payload, true);

        StreamByteSource source = new StreamByteSource(new ByteArrayInputStream(wire.toByteArray()));
        GrpcFrame frame = decoder.readMessage(source, false).orElseThrow();

        assertEquals(payload.length, frame.length());
        assertArrayEquals(payload, frame.payload());
    }
}
