package com.questrail.grpcwire.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.grpcwire.codec.CorruptFrameException;
import com.questrail.grpcwire.codec.ReadCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jGrpcFramingObservabilitySinkTest {
    private final Slf4jGrpcFramingObservabilitySink sink = new Slf4jGrpcFramingObservabilitySink();

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private Level originalLevel;

    @BeforeEach
    void attachAppender() {
        logger = (Logger) LoggerFactory.getLogger(Slf4jGrpcFramingObservabilitySink.class);
        originalLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
        logger.setLevel(originalLevel);
        appender.stop();
    }

    @Test
    void decodedAndEncodedFramesLogAtDebug() {
        sink.onFrameDecoded(new FrameDecodedEvent(Instant.now(), 449, true, 3));
        sink.onFrameEncoded(new FrameEncodedEvent(Instant.now(), 12, false));
        sink.onEndOfStream();

        List<ILoggingEvent> events = appender.list;
        assertEquals(3, events.size());
        events.forEach(e -> assertEquals(Level.DEBUG, e.getLevel()));
        assertEquals("gRPC frame decoded: length=449 multipleMessages=true reads=3", events.get(0).getFormattedMessage());
        assertEquals("gRPC frame encoded: length=12 flushed=false", events.get(1).getFormattedMessage());
        assertEquals("gRPC message stream ended", events.get(2).getFormattedMessage());
    }

    @Test
    void framingErrorsLogAtErrorWithCause() {
        CorruptFrameException cause = new CorruptFrameException("Unexpected compressed flag value in message header: 0x02");

        sink.onError(new GrpcFramingErrorEvent(Instant.now(), cause.getMessage(), cause));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.ERROR, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("0x02"));
        assertNotNull(event.getThrowableProxy());
    }

    @Test
    void cancellationLogsAtWarnWithoutStackTrace() {
        ReadCancelledException cause = new ReadCancelledException();

        sink.onError(new GrpcFramingErrorEvent(Instant.now(), cause.getMessage(), cause));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertEquals("gRPC read cancelled: Incoming message cancelled.", event.getFormattedMessage());
        assertNull(event.getThrowableProxy());
    }
}
