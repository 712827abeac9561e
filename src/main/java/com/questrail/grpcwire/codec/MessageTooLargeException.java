package com.questrail.grpcwire.codec;

/**
 * The declared message length exceeds the signed 32-bit range, or the inbound
 * limit configured on the decoder.
 *
 * <p>The stream should be considered corrupted once this is raised.</p>
 */
public final class MessageTooLargeException extends GrpcFramingException
{
    private final long declaredLength;

    public MessageTooLargeException(long declaredLength)
    {
        super("Message too large: " + declaredLength);
        this.declaredLength = declaredLength;
    }

    public MessageTooLargeException(long declaredLength, int limit)
    {
        super("Message too large: " + declaredLength + " exceeds limit " + limit);
        this.declaredLength = declaredLength;
    }

    /**
     * Returns the length announced by the frame header, as an unsigned value.
     */
    public long declaredLength()
    {
        return declaredLength;
    }
}
