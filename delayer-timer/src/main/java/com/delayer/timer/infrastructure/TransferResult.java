package com.delayer.timer.infrastructure;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Reply of {@link JobStore#removeAndAppend}: the ids that were still pooled and got
 * pushed, and the ready queue's length afterwards.
 */
@Data
@AllArgsConstructor
public class TransferResult {

    private final List<String> movedIds;
    private final long queueLength;

    public long getRemoved() {
        return movedIds.size();
    }
}
