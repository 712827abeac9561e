package com.questrail.grpcwire.frame;

import java.util.Objects;

/**
 * GrpcFrame
 * -----------------------------------------------------------------------------
 * Immutable, decoded representation of one length-prefixed gRPC message.
 *
 * <h2>What this represents</h2>
 * A {@code GrpcFrame} is a message after:
 * <ul>
 *   <li>the 5-byte header has been validated</li>
 *   <li>the full payload has been received</li>
 *   <li>the payload has been copied out of the transport's buffers</li>
 * </ul>
 *
 * The payload is opaque at this layer; schema interpretation belongs to the
 * caller.
 *
 * Immutability is enforced via defensive copying, except for arrays handed
 * over through {@link #adopt(boolean, byte[])}.
 */
public final class GrpcFrame
{
    private static final byte[] EMPTY = new byte[0];

    /**
     * Compression flag as carried on the wire. Always {@code false} for frames
     * produced by this codec, since compressed input is refused.
     */
    private final boolean compressed;

    /**
     * Payload bytes (may be empty, never null).
     */
    private final byte[] payload;

    public GrpcFrame(boolean compressed, byte[] payload)
    {
        this((payload == null || payload.length == 0) ? EMPTY : payload.clone(), compressed);
    }

    private GrpcFrame(byte[] owned, boolean compressed)
    {
        this.compressed = compressed;
        this.payload = owned.length == 0 ? EMPTY : owned;
    }

    /**
     * Frame that takes ownership of {@code payload} without copying it.
     *
     * <p>The caller must not modify or hand out {@code payload} afterwards.
     * Intended for decoders that have just copied the bytes out of a
     * transport buffer.</p>
     */
    public static GrpcFrame adopt(boolean compressed, byte[] payload)
    {
        return new GrpcFrame(Objects.requireNonNull(payload, "payload"), compressed);
    }

    /**
     * Uncompressed frame carrying {@code payload}.
     */
    public static GrpcFrame of(byte[] payload)
    {
        return new GrpcFrame(false, payload);
    }

    public boolean compressed()
    {
        return compressed;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload()
    {
        return payload.clone();
    }

    public int length()
    {
        return payload.length;
    }

    @Override
    public String toString()
    {
        return "GrpcFrame[" +
                "compressed=" + compressed +
                ", length=" + payload.length +
                ']';
    }
}
