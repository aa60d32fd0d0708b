package com.delayer.timer.service;

import com.delayer.timer.domain.MoveResult;
import com.delayer.timer.exception.PartialCommitException;
import com.delayer.timer.exception.StoreException;
import com.delayer.timer.infrastructure.JobStore;
import com.delayer.timer.infrastructure.StoreKeys;
import com.delayer.timer.infrastructure.TransferResult;
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
 * Moves topic groups from the job pool into their ready queues.
 * <p>
 * Every group is one atomic store call on the move pool that removes the ids from the
 * pool and pushes only the removed ones onto the queue, so groups succeed or fail
 * independently and a job taken by a concurrent pass is never pushed twice. A failed
 * group stays in the job pool and is picked up again on the next tick.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueueMover {

    private final JobStore jobStore;
    private final ExecutorService moveExecutorService;
    private final ErrorReporter errorReporter;
    private final ReadyJobListener readyJobListener;
    private final TimerMetricsService metricsService;

    /**
     * Move all groups concurrently and wait for every move to finish.
     */
    public List<MoveResult> moveAll(Map<String, List<String>> groups) {
        if (groups.isEmpty()) {
            return List.of();
        }

        Map<String, String> context = MDC.getCopyOfContextMap();
        CompletionService<MoveResult> completion = new ExecutorCompletionService<>(moveExecutorService);
        groups.forEach((topic, jobIds) -> completion.submit(() -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return move(topic, jobIds);
            } finally {
                MDC.clear();
            }
        }));

        List<MoveResult> results = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            try {
                results.add(completion.take().get());
            } catch (ExecutionException e) {
                log.error("Move task failed: {}", e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while moving jobs to ready queues", e);
            }
        }
        return results;
    }

    /**
     * Move one topic group in a single atomic store call.
     *
     * @return on success, the ids this call moved, which may be fewer than requested
     */
    public MoveResult move(String topic, List<String> jobIds) {
        MDC.put("topic", topic);
        String jobIdsStr = String.join(",", jobIds);

        try {
            TransferResult transfer = jobStore.removeAndAppend(
                    StoreKeys.JOB_POOL, StoreKeys.readyQueue(topic), jobIds);
            List<String> movedIds = transfer.getMovedIds();

            if (movedIds.isEmpty() || transfer.getQueueLength() == 0) {
                throw new PartialCommitException(topic, movedIds.size(), transfer.getQueueLength());
            }
            if (movedIds.size() < jobIds.size()) {
                // The rest were taken by a concurrent pass between fetch and move
                log.warn("Only {} of {} jobs were still pooled, IDs: [{}]",
                        movedIds.size(), jobIds.size(), jobIdsStr);
            }

            readyJobListener.onReady(topic, movedIds);
            metricsService.recordPromoted(movedIds.size());

            return MoveResult.builder()
                    .topic(topic)
                    .jobIds(movedIds)
                    .removed(movedIds.size())
                    .queueLength(transfer.getQueueLength())
                    .success(true)
                    .build();

        } catch (PartialCommitException e) {
            errorReporter.report(e, "commit", jobIdsStr);
            metricsService.recordPartialCommit();
            return failed(topic, jobIds, e);
        } catch (StoreException e) {
            errorReporter.report(e, "moveJobToReadyQueue", jobIdsStr);
            metricsService.recordMoveFailed();
            return failed(topic, jobIds, e);
        } finally {
            MDC.remove("topic");
        }
    }

    private static MoveResult failed(String topic, List<String> jobIds, Exception error) {
        return MoveResult.builder()
                .topic(topic)
                .jobIds(jobIds)
                .success(false)
                .failureReason(error.getMessage())
                .build();
    }
}
