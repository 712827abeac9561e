package com.questrail.grpcwire.frame;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class GrpcFrameTest
{
    @Test
    void constructorCopiesPayload()
    {
        byte[] payload = { 1, 2, 3 };

        GrpcFrame frame = new GrpcFrame(false, payload);
        payload[0] = 9;

        assertArrayEquals(new byte[] { 1, 2, 3 }, frame.payload());
    }

    /**
     * Verifies that an adopted array becomes the frame's storage as is, so a
     * decoder's single copy out of the transport is the only one made.
     */
    @Test
    void adoptTakesOwnershipWithoutCopy()
    {
        byte[] payload = { 1, 2, 3 };

        GrpcFrame frame = GrpcFrame.adopt(true, payload);
        payload[0] = 9;

        assertTrue(frame.compressed());
        assertEquals(3, frame.length());
        assertEquals(9, frame.payload()[0]);
    }

    @Test
    void payloadAccessorReturnsCopy()
    {
        GrpcFrame frame = GrpcFrame.adopt(false, new byte[] { 1, 2 });

        frame.payload()[0] = 7;

        assertArrayEquals(new byte[] { 1, 2 }, frame.payload());
    }

    @Test
    void emptyAndNullPayloads()
    {
        assertEquals(0, GrpcFrame.of(null).length());
        assertEquals(0, GrpcFrame.adopt(false, new byte[0]).length());
        assertThrows(NullPointerException.class, () -> GrpcFrame.adopt(false, null));
    }
}
