package com.questrail.grpcwire.config;

import com.questrail.grpcwire.observability.GrpcFramingObservabilitySink;
import com.questrail.grpcwire.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Configuration shared by the gRPC frame codec and its transport adapters.
 *
 * @param maxInboundMessageSize largest payload length the decoder accepts
 * @param segmentSize           array size used by stream adapters for buffering
 * @param observabilitySink     receiver of codec events
 */
public record GrpcFramingConfig(
    int maxInboundMessageSize,
    int segmentSize,
    GrpcFramingObservabilitySink observabilitySink
) {
    public static final int DEFAULT_SEGMENT_SIZE = 4096;

    public GrpcFramingConfig {
        if (maxInboundMessageSize < 0) {
            throw new IllegalArgumentException("maxInboundMessageSize must not be negative: " + maxInboundMessageSize);
        }
        if (segmentSize <= 0) {
            throw new IllegalArgumentException("segmentSize must be positive: " + segmentSize);
        }
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static GrpcFramingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxInboundMessageSize = Integer.MAX_VALUE;
        private int segmentSize = DEFAULT_SEGMENT_SIZE;
        private GrpcFramingObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withMaxInboundMessageSize(int maxInboundMessageSize) {
            this.maxInboundMessageSize = maxInboundMessageSize;
            return this;
        }

        public Builder withSegmentSize(int segmentSize) {
            this.segmentSize = segmentSize;
            return this;
        }

        public Builder withObservabilitySink(GrpcFramingObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public GrpcFramingConfig build() {
            return new GrpcFramingConfig(maxInboundMessageSize, segmentSize, observabilitySink);
        }
    }
}
