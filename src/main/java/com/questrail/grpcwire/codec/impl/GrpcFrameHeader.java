package com.questrail.grpcwire.codec.impl;

import com.questrail.grpcwire.buffer.ByteSequence;
import com.questrail.grpcwire.codec.BufferTooSmallException;
import com.questrail.grpcwire.codec.CorruptFrameException;
import com.questrail.grpcwire.codec.MessageTooLargeException;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

/**
 * GrpcFrameHeader
 * -----------------------------------------------------------------------------
 * The 5-byte header preceding every gRPC message, and the bit-exact rules for
 * reading and writing it.
 *
 * <pre>
 *   byte 0     compression flag: 0x00 = plain, 0x01 = compressed
 *   bytes 1-4  payload length, unsigned 32-bit, most significant byte first
 * </pre>
 *
 * <p>Although the length field is unsigned, values above
 * {@link Integer#MAX_VALUE} are refused so that every payload fits a Java
 * array.</p>
 *
 * @param compressed    compression flag as decoded
 * @param messageLength payload length in bytes
 */
public record GrpcFrameHeader(boolean compressed, int messageLength)
{
    /** Size of the length field ("Message-Length"). */
    public static final int LENGTH_FIELD_SIZE = 4;

    /** Compression flag plus length field. */
    public static final int HEADER_SIZE = LENGTH_FIELD_SIZE + 1;

    static final byte FLAG_UNCOMPRESSED = 0;
    static final byte FLAG_COMPRESSED = 1;

    public GrpcFrameHeader {
        if (messageLength < 0) {
            throw new IllegalArgumentException("messageLength must not be negative: " + messageLength);
        }
    }

    /**
     * Header for an uncompressed payload of {@code messageLength} bytes.
     */
    public static GrpcFrameHeader uncompressed(int messageLength)
    {
        return new GrpcFrameHeader(false, messageLength);
    }

    /**
     * Total frame size: header plus payload.
     */
    public long frameLength()
    {
        return HEADER_SIZE + (long) messageLength;
    }

    /**
     * Write this header at the position of {@code destination}, advancing it by
     * {@value #HEADER_SIZE} bytes.
     */
    public void writeTo(ByteBuffer destination)
    {
        Objects.requireNonNull(destination, "destination");
        if (destination.remaining() < HEADER_SIZE) {
            throw new BufferTooSmallException("Buffer too small to encode message header.");
        }

        destination.put(compressed ? FLAG_COMPRESSED : FLAG_UNCOMPRESSED);
        encodeLength(messageLength, destination);
    }

    /**
     * Write {@code length} as 4 big-endian bytes at the position of
     * {@code destination}, advancing it.
     *
     * @throws BufferTooSmallException if fewer than 4 bytes remain
     */
    public static void encodeLength(int length, ByteBuffer destination)
    {
        Objects.requireNonNull(destination, "destination");
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
        if (destination.remaining() < LENGTH_FIELD_SIZE) {
            throw new BufferTooSmallException("Buffer too small to encode message length.");
        }

        // msg length stored in big endian
        for (int shift = 24; shift >= 0; shift -= 8) {
            destination.put((byte) ((length >>> shift) & 0xFF));
        }
    }

    /**
     * Read a 4-byte big-endian length at the position of {@code source},
     * advancing it.
     *
     * @throws BufferTooSmallException  if fewer than 4 bytes remain
     * @throws MessageTooLargeException if the value exceeds {@link Integer#MAX_VALUE}
     */
    public static int decodeLength(ByteBuffer source) throws MessageTooLargeException
    {
        Objects.requireNonNull(source, "source");
        if (source.remaining() < LENGTH_FIELD_SIZE) {
            throw new BufferTooSmallException("Buffer too small to decode message length.");
        }

        // Byte-wise so the result does not depend on the buffer's byte order.
        long result = 0;
        for (int i = 0; i < LENGTH_FIELD_SIZE; i++) {
            result = (result << 8) | (source.get() & 0xFF);
        }

        if (result > Integer.MAX_VALUE) {
            throw new MessageTooLargeException(result);
        }
        return (int) result;
    }

    /**
     * Interpret the compression flag byte.
     *
     * @throws CorruptFrameException for any value other than 0 or 1
     */
    public static boolean decodeCompressionFlag(byte flag) throws CorruptFrameException
    {
        if (flag == FLAG_UNCOMPRESSED) {
            return false;
        }
        if (flag == FLAG_COMPRESSED) {
            return true;
        }
        throw new CorruptFrameException(String.format(
                "Unexpected compressed flag value in message header: 0x%02X", flag & 0xFF));
    }

    /**
     * Decode a header from the first {@value #HEADER_SIZE} bytes of {@code buffer}.
     *
     * @return the header, or {@link Optional#empty()} if fewer than
     *         {@value #HEADER_SIZE} bytes are buffered
     */
    public static Optional<GrpcFrameHeader> tryRead(ByteSequence buffer)
            throws CorruptFrameException, MessageTooLargeException
    {
        Objects.requireNonNull(buffer, "buffer");
        if (buffer.length() < HEADER_SIZE) {
            return Optional.empty();
        }

        ByteBuffer headerData = buffer.first();
        if (headerData.remaining() < HEADER_SIZE) {
            // Header straddles segments; gather it into a scratch array.
            byte[] scratch = new byte[HEADER_SIZE];
            buffer.copyTo(0, scratch, 0, HEADER_SIZE);
            headerData = ByteBuffer.wrap(scratch);
        }

        boolean compressed = decodeCompressionFlag(headerData.get());
        int messageLength = decodeLength(headerData);
        return Optional.of(new GrpcFrameHeader(compressed, messageLength));
    }
}
