package com.delayer.timer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of moving one topic group into its ready queue.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MoveResult {

    private String topic;
    private List<String> jobIds;
    private long removed;
    private long queueLength;
    private boolean success;
    private String failureReason;
}
