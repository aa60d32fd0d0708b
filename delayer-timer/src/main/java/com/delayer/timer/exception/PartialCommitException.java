package com.delayer.timer.exception;

import lombok.Getter;

/**
 * The move reached the store but had no effect, usually because a
 * concurrent pass already took the jobs out of the job pool.
 */
@Getter
public class PartialCommitException extends DelayerException {

    private final String topic;
    private final long removed;
    private final long queueLength;

    public PartialCommitException(String topic, long removed, long queueLength) {
        super(String.format("Move for topic %s had no effect (removed=%d, queueLength=%d)",
                topic, removed, queueLength));
        this.topic = topic;
        this.removed = removed;
        this.queueLength = queueLength;
    }
}
