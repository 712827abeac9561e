package com.questrail.grpcwire.buffer;

/**
 * ByteArrayPool
 * -----------------------------------------------------------------------------
 * Source of reusable byte arrays for transport adapters.
 *
 * <p>The pool belongs to the transport, never to the codec. A transport rents
 * arrays to hold inbound or outbound segments and returns them once the codec
 * has consumed (or the transport has flushed) every byte they hold.</p>
 */
public interface ByteArrayPool
{
    /**
     * Rent an array of at least {@code minimumLength} bytes.
     *
     * <p>The contents of the returned array are unspecified.</p>
     */
    byte[] rent(int minimumLength);

    /**
     * Give an array back to the pool. The caller must not touch it afterwards.
     */
    void release(byte[] array);

    /**
     * A pool that always allocates and never retains anything.
     */
    static ByteArrayPool unpooled()
    {
        return new ByteArrayPool() {
            @Override
            public byte[] rent(int minimumLength)
            {
                return new byte[minimumLength];
            }

            @Override
            public void release(byte[] array)
            {
            }
        };
    }
}
