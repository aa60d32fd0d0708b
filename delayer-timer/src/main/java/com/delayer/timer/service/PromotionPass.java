package com.delayer.timer.service;

import com.delayer.timer.domain.MoveResult;
import com.delayer.timer.domain.PassReport;
import com.delayer.timer.domain.ResolutionStatus;
import com.delayer.timer.domain.ResolvedJob;
import com.delayer.timer.exception.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One Fetch -> Resolve -> Group -> Move pass over the job pool.
 * <p>
 * A pass holds no state shared with other passes, so the timer may run several at
 * once. Every failure degrades to "retry on the next tick": nothing thrown by a
 * stage escapes {@link #execute()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromotionPass {

    private final ExpiryFetcher expiryFetcher;
    private final TopicResolver topicResolver;
    private final TopicGrouper topicGrouper;
    private final QueueMover queueMover;
    private final ErrorReporter errorReporter;
    private final TimerMetricsService metricsService;
    private final Clock clock;

    public PassReport execute() {
        String passId = UUID.randomUUID().toString().substring(0, 8);
        Instant startedAt = clock.instant();
        long startTime = System.currentTimeMillis();
        MDC.put("passId", passId);

        PassReport.PassReportBuilder report = PassReport.builder()
                .passId(passId)
                .startedAt(startedAt)
                .moves(List.of());

        try {
            List<String> expired;
            try {
                expired = expiryFetcher.fetchExpired(startedAt);
            } catch (StoreException e) {
                errorReporter.report(e, "getExpireJobs", "");
                metricsService.recordPassAborted();
                return report.aborted(true).durationMs(System.currentTimeMillis() - startTime).build();
            }

            report.expired(expired.size());
            if (expired.isEmpty()) {
                return report.durationMs(System.currentTimeMillis() - startTime).build();
            }

            List<ResolvedJob> resolved = topicResolver.resolve(expired);
            Map<String, List<String>> groups = topicGrouper.group(resolved);
            List<MoveResult> moves = queueMover.moveAll(groups);

            int promoted = moves.stream().filter(MoveResult::isSuccess).mapToInt(m -> m.getJobIds().size()).sum();
            int failedGroups = (int) moves.stream().filter(m -> !m.isSuccess()).count();

            report.resolved(count(resolved, ResolutionStatus.RESOLVED))
                    .orphans(count(resolved, ResolutionStatus.ORPHANED))
                    .lookupFailures(count(resolved, ResolutionStatus.FAILED))
                    .promoted(promoted)
                    .failedGroups(failedGroups)
                    .moves(moves)
                    .durationMs(System.currentTimeMillis() - startTime);

            PassReport built = report.build();
            log.debug("Pass finished - expired: {}, promoted: {}, orphans: {}, lookup failures: {}, failed groups: {}",
                    built.getExpired(), built.getPromoted(), built.getOrphans(),
                    built.getLookupFailures(), built.getFailedGroups());
            return built;

        } catch (RuntimeException e) {
            errorReporter.report(e, "run", "");
            return report.aborted(true).durationMs(System.currentTimeMillis() - startTime).build();
        } finally {
            metricsService.recordPass(System.currentTimeMillis() - startTime);
            MDC.remove("passId");
        }
    }

    private static int count(List<ResolvedJob> resolved, ResolutionStatus status) {
        return (int) resolved.stream().filter(job -> job.getStatus() == status).count();
    }
}
