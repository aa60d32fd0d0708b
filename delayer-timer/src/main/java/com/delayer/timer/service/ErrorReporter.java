package com.delayer.timer.service;

/**
 * Sink for failures raised by the timer's stages.
 */
@FunctionalInterface
public interface ErrorReporter {

    /**
     * Report a failure.
     *
     * @param error     what went wrong
     * @param operation the stage or store operation that failed
     * @param data      context such as the affected job ids, may be empty
     */
    void report(Throwable error, String operation, String data);
}
