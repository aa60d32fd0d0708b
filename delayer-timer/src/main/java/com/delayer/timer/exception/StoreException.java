package com.delayer.timer.exception;

/**
 * Connectivity or protocol failure while talking to Redis.
 * The affected job or topic is retried on the next timer tick.
 */
public class StoreException extends DelayerException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
