package com.questrail.grpcwire.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements GrpcFramingObservabilitySink {
    public static final Object END_OF_STREAM = "END_OF_STREAM";

    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onFrameDecoded(FrameDecodedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onFrameEncoded(FrameEncodedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onEndOfStream() {
        events.add(END_OF_STREAM);
    }

    @Override
    public synchronized void onError(GrpcFramingErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> getEventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
