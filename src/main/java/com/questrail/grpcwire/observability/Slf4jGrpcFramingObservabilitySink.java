package com.questrail.grpcwire.observability;

import com.questrail.grpcwire.codec.ReadCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GrpcFramingObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jGrpcFramingObservabilitySink implements GrpcFramingObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGrpcFramingObservabilitySink.class);

    @Override
    public void onFrameDecoded(FrameDecodedEvent event) {
        log.debug("gRPC frame decoded: length={} multipleMessages={} reads={}",
            event.messageLength(),
            event.multipleMessages(),
            event.reads());
    }

    @Override
    public void onFrameEncoded(FrameEncodedEvent event) {
        log.debug("gRPC frame encoded: length={} flushed={}",
            event.messageLength(),
            event.flushed());
    }

    @Override
    public void onEndOfStream() {
        log.debug("gRPC message stream ended");
    }

    @Override
    public void onError(GrpcFramingErrorEvent event) {
        // Cancellation is requested by our own side, not a wire defect.
        if (event.cause() instanceof ReadCancelledException) {
            log.warn("gRPC read cancelled: {}", event.message());
            return;
        }
        log.error("gRPC framing error: {}", event.message(), event.cause());
    }
}
