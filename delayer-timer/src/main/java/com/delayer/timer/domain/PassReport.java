package com.delayer.timer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one Fetch -> Resolve -> Group -> Move pass.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PassReport {

    private String passId;
    private Instant startedAt;
    private boolean aborted;
    private int expired;
    private int resolved;
    private int orphans;
    private int lookupFailures;
    private int promoted;
    private int failedGroups;
    private List<MoveResult> moves;
    private long durationMs;
}
