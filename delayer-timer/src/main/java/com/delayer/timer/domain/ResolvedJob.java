package com.delayer.timer.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A job id paired with the topic its bucket names.
 * The topic is empty unless the lookup succeeded.
 */
@Data
@AllArgsConstructor
public class ResolvedJob {

    private final String jobId;
    private final String topic;
    private final ResolutionStatus status;

    public static ResolvedJob resolved(String jobId, String topic) {
        return new ResolvedJob(jobId, topic, ResolutionStatus.RESOLVED);
    }

    public static ResolvedJob orphaned(String jobId) {
        return new ResolvedJob(jobId, "", ResolutionStatus.ORPHANED);
    }

    public static ResolvedJob failed(String jobId) {
        return new ResolvedJob(jobId, "", ResolutionStatus.FAILED);
    }

    public boolean hasTopic() {
        return topic != null && !topic.isEmpty();
    }
}
