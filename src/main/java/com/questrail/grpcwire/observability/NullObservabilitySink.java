package com.questrail.grpcwire.observability;

/**
 * No-op implementation of GrpcFramingObservabilitySink.
 */
public final class NullObservabilitySink implements GrpcFramingObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onFrameDecoded(FrameDecodedEvent event) {}

    @Override
    public void onFrameEncoded(FrameEncodedEvent event) {}

    @Override
    public void onEndOfStream() {}

    @Override
    public void onError(GrpcFramingErrorEvent event) {}
}
