package com.questrail.grpcwire.observability;

/**
 * Receives events from the gRPC frame codec.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface GrpcFramingObservabilitySink {
    /**
     * Called after a complete frame has been decoded and handed to the caller.
     * @param event the decoded frame details
     */
    void onFrameDecoded(FrameDecodedEvent event);

    /**
     * Called after a frame has been written to a sink or stream.
     * @param event the encoded frame details
     */
    void onFrameEncoded(FrameEncodedEvent event);

    /**
     * Called when a multi-message read finds the stream finished with no data left.
     */
    void onEndOfStream();

    /**
     * Called when a read or write fails, before the failure is rethrown.
     * @param event the error event
     */
    void onError(GrpcFramingErrorEvent event);
}
