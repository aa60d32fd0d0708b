package com.delayer.timer.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes failures as single ERROR lines: {@code FAILURE: func <operation>, <message>, [<data>].}
 */
@Component
@Slf4j
public class LoggingErrorReporter implements ErrorReporter {

    @Override
    public void report(Throwable error, String operation, String data) {
        if (error == null) {
            return;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        String context = (data == null || data.isEmpty()) ? "" : ", [" + data + "]";

        log.error("FAILURE: func {}, {}{}.", operation, message, context);
        log.debug("Stack trace for failed {}", operation, error);
    }
}
