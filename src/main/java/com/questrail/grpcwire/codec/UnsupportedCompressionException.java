package com.questrail.grpcwire.codec;

/**
 * A well-formed frame announced a compressed payload.
 *
 * <p>This is not a protocol violation by the peer: no decompressor exists in
 * this codec, so compressed frames are refused.</p>
 */
public final class UnsupportedCompressionException extends GrpcFramingException
{
    public UnsupportedCompressionException()
    {
        super("Compressed messages are not yet supported.");
    }
}
