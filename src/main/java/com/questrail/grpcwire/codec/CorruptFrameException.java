package com.questrail.grpcwire.codec;

/**
 * The frame header carries a compression flag other than {@code 0} or {@code 1}.
 */
public final class CorruptFrameException extends GrpcFramingException
{
    public CorruptFrameException(String message)
    {
        super(message);
    }
}
