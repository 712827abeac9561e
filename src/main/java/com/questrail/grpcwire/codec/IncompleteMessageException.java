package com.questrail.grpcwire.codec;

/**
 * The stream did not yield exactly the frames the caller asked for.
 *
 * <p>Raised when the transport completes before a whole frame has arrived, and
 * in single-message mode when bytes follow the one expected message.</p>
 */
public final class IncompleteMessageException extends GrpcFramingException
{
    public IncompleteMessageException(String message)
    {
        super(message);
    }
}
