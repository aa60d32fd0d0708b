package com.delayer.timer.service;

import com.delayer.timer.domain.ResolvedJob;
import com.delayer.timer.exception.JobMetadataNotFoundException;
import com.delayer.timer.exception.StoreException;
import com.delayer.timer.infrastructure.JobStore;
import com.delayer.timer.infrastructure.StoreKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;

/**
 * Looks up the topic of every expired job concurrently.
 * <p>
 * One lookup task is queued per job on the lookup pool and the caller collects
 * exactly as many results as it dispatched, in completion order. Jobs without a
 * bucket are orphans and are purged from the job pool on a best-effort basis.
 * Any other failure leaves the job in the pool for the next tick.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopicResolver {

    private final JobStore jobStore;
    private final ExecutorService lookupExecutorService;
    private final ErrorReporter errorReporter;
    private final TimerMetricsService metricsService;

    public List<ResolvedJob> resolve(List<String> jobIds) {
        if (jobIds.isEmpty()) {
            return List.of();
        }

        Map<String, String> context = MDC.getCopyOfContextMap();
        CompletionService<ResolvedJob> completion = new ExecutorCompletionService<>(lookupExecutorService);
        for (String jobId : jobIds) {
            completion.submit(() -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    return resolveOne(jobId);
                } finally {
                    MDC.clear();
                }
            });
        }

        List<ResolvedJob> resolved = new ArrayList<>(jobIds.size());
        for (int i = 0; i < jobIds.size(); i++) {
            try {
                resolved.add(completion.take().get());
            } catch (ExecutionException e) {
                // resolveOne handles its own failures, so this is a bug rather than a store problem
                log.error("Topic lookup task failed: {}", e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while resolving topics", e);
            }
        }
        return resolved;
    }

    ResolvedJob resolveOne(String jobId) {
        String topic;
        try {
            topic = jobStore.getField(StoreKeys.jobBucket(jobId), StoreKeys.TOPIC_FIELD);
        } catch (JobMetadataNotFoundException e) {
            log.warn("Job {} has no bucket, removing it from {}", jobId, StoreKeys.JOB_POOL);
            metricsService.recordOrphaned();
            removeOrphan(jobId);
            return ResolvedJob.orphaned(jobId);
        } catch (StoreException e) {
            errorReporter.report(e, "getJobTopic", jobId);
            metricsService.recordLookupFailed();
            return ResolvedJob.failed(jobId);
        }

        if (topic == null || topic.isBlank()) {
            // Bucket still exists, so this is not an orphan; it stays pooled until a topic is set
            log.warn("Job {} has no topic in its bucket, leaving it in {}", jobId, StoreKeys.JOB_POOL);
            metricsService.recordLookupFailed();
            return ResolvedJob.failed(jobId);
        }
        return ResolvedJob.resolved(jobId, topic);
    }

    private void removeOrphan(String jobId) {
        try {
            long removed = jobStore.removeMembers(StoreKeys.JOB_POOL, List.of(jobId));
            if (removed == 0) {
                log.debug("Orphan {} was already gone from {}", jobId, StoreKeys.JOB_POOL);
            }
        } catch (StoreException e) {
            // The orphan is fetched again next tick and removal is retried then
            errorReporter.report(e, "removeOrphan", jobId);
        }
    }
}
