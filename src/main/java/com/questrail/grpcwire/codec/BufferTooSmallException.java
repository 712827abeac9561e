package com.questrail.grpcwire.codec;

/**
 * A header field was read from or written to a buffer with too little room.
 *
 * <p>This is a programming error inside the caller and is never reported to a
 * remote peer, hence unchecked.</p>
 */
public final class BufferTooSmallException extends IllegalArgumentException
{
    public BufferTooSmallException(String message)
    {
        super(message);
    }
}
