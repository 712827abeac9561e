package com.questrail.grpcwire.observability;

import java.time.Instant;

/**
 * Record describing a frame written by the encoder.
 */
public record FrameEncodedEvent(
    Instant timestamp,
    int messageLength,
    boolean flushed
) {
}
