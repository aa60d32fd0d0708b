package com.delayer.timer.exception;

import lombok.Getter;

/**
 * The job bucket of a pooled job no longer exists. Not a failure: the job is an
 * orphan and gets purged from the job pool.
 */
@Getter
public class JobMetadataNotFoundException extends DelayerException {

    private final String bucketKey;

    public JobMetadataNotFoundException(String bucketKey) {
        super("Job bucket not found: " + bucketKey);
        this.bucketKey = bucketKey;
    }
}
