package com.questrail.grpcwire.codec;

import java.io.IOException;

/**
 * Root of all wire-level failures raised while reading or writing gRPC frames.
 *
 * <p>A framing failure ends the current read or write. The codec never
 * retries; whether the surrounding exchange is retried is decided by the
 * transport or RPC layer that owns the stream.</p>
 */
public class GrpcFramingException extends IOException
{
    public GrpcFramingException(String message)
    {
        super(message);
    }

    public GrpcFramingException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
