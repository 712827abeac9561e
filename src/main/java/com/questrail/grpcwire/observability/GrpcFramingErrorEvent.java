package com.questrail.grpcwire.observability;

import java.time.Instant;

/**
 * Record representing a failed read or write in the framing layer.
 */
public record GrpcFramingErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
