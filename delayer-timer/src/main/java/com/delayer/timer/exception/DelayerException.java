package com.delayer.timer.exception;

/**
 * Base type for failures raised while promoting delayed jobs.
 */
public class DelayerException extends RuntimeException {

    public DelayerException(String message) {
        super(message);
    }

    public DelayerException(String message, Throwable cause) {
        super(message, cause);
    }
}
