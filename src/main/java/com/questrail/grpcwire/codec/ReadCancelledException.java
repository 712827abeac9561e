package com.questrail.grpcwire.codec;

/**
 * The pending read was cancelled before a frame could be produced.
 *
 * <p>No bytes are consumed by a cancelled read, so the source stays positioned
 * where it was and a later call may pick up the same data.</p>
 */
public final class ReadCancelledException extends GrpcFramingException
{
    public ReadCancelledException()
    {
        super("Incoming message cancelled.");
    }
}
