package com.delayer.timer.infrastructure;

/**
 * Redis key layout shared with job producers and consumers. Changing any of these
 * breaks compatibility with existing data.
 */
public final class StoreKeys {

    public static final String JOB_POOL = "delayer:job_pool";
    public static final String JOB_BUCKET_PREFIX = "delayer:job_bucket:";
    public static final String READY_QUEUE_PREFIX = "delayer:ready_queue:";

    public static final String TOPIC_FIELD = "topic";

    private StoreKeys() {
    }

    public static String jobBucket(String jobId) {
        return JOB_BUCKET_PREFIX + jobId;
    }

    public static String readyQueue(String topic) {
        return READY_QUEUE_PREFIX + topic;
    }
}
