package com.delayer.timer.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.delayer.timer.exception.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the log lines written by the default reporting sinks.
 */
class LoggingReportersTest {

    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void setUp() {
        appender.start();
        logger(LoggingErrorReporter.class).addAppender(appender);
        logger(LoggingReadyJobListener.class).addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger(LoggingErrorReporter.class).detachAppender(appender);
        logger(LoggingReadyJobListener.class).detachAppender(appender);
    }

    @Test
    void testErrorReporter_FormatsOperationAndData() {
        new LoggingErrorReporter().report(new StoreException("Connection refused"), "commit", "job1,job2");

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.ERROR, event.getLevel());
        assertEquals("FAILURE: func commit, Connection refused, [job1,job2].", event.getFormattedMessage());
    }

    @Test
    void testErrorReporter_OmitsEmptyData() {
        new LoggingErrorReporter().report(new StoreException("Connection refused"), "getExpireJobs", "");

        assertEquals("FAILURE: func getExpireJobs, Connection refused.", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void testErrorReporter_IgnoresNullError() {
        new LoggingErrorReporter().report(null, "commit", "job1");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void testReadyJobListener_LogsTopicAndIds() {
        new LoggingReadyJobListener().onReady("alerts", List.of("job1", "job2"));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.INFO, event.getLevel());
        assertEquals("Job is ready, Topic: alerts, IDs: [job1,job2]", event.getFormattedMessage());
    }

    private static Logger logger(Class<?> type) {
        return (Logger) LoggerFactory.getLogger(type);
    }
}
