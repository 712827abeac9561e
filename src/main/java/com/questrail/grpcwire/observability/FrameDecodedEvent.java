package com.questrail.grpcwire.observability;

import java.time.Instant;

/**
 * Record describing a frame returned by the decoder.
 *
 * @param reads number of transport reads the decode needed
 */
public record FrameDecodedEvent(
    Instant timestamp,
    int messageLength,
    boolean multipleMessages,
    int reads
) {
}
