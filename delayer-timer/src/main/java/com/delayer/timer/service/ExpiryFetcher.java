package com.delayer.timer.service;

import com.delayer.timer.infrastructure.JobStore;
import com.delayer.timer.infrastructure.StoreKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Reads the ids of jobs whose ready-at time has passed.
 * Job pool scores are epoch seconds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpiryFetcher {

    private final JobStore jobStore;

    /**
     * @param now the pass's reference time
     * @return ids with ready-at &lt;= now, empty if nothing is due
     * @throws com.delayer.timer.exception.StoreException if the job pool cannot be read
     */
    public List<String> fetchExpired(Instant now) {
        List<String> jobIds = jobStore.rangeByScore(StoreKeys.JOB_POOL, 0, now.getEpochSecond());
        if (!jobIds.isEmpty()) {
            log.debug("{} expired jobs in {}", jobIds.size(), StoreKeys.JOB_POOL);
        }
        return jobIds;
    }
}
