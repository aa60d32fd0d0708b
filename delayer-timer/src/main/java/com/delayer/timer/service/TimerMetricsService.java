package com.delayer.timer.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking promotion metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class TimerMetricsService {

    private final Counter passesCounter;
    private final Counter passesAbortedCounter;
    private final Counter jobsPromotedCounter;
    private final Counter jobsOrphanedCounter;
    private final Counter lookupsFailedCounter;
    private final Counter movesFailedCounter;
    private final Counter partialCommitsCounter;
    private final Timer passTimer;

    public TimerMetricsService(MeterRegistry meterRegistry) {
        this.passesCounter = Counter.builder("delayer.passes")
                .description("Total number of promotion passes run")
                .register(meterRegistry);

        this.passesAbortedCounter = Counter.builder("delayer.passes.aborted")
                .description("Passes aborted because the job pool could not be read")
                .register(meterRegistry);

        this.jobsPromotedCounter = Counter.builder("delayer.jobs.promoted")
                .description("Jobs moved from the job pool into a ready queue")
                .register(meterRegistry);

        this.jobsOrphanedCounter = Counter.builder("delayer.jobs.orphaned")
                .description("Jobs found in the job pool without a job bucket")
                .register(meterRegistry);

        this.lookupsFailedCounter = Counter.builder("delayer.lookups.failed")
                .description("Topic lookups that failed and were left for the next tick")
                .register(meterRegistry);

        this.movesFailedCounter = Counter.builder("delayer.moves.failed")
                .description("Topic groups whose move failed")
                .register(meterRegistry);

        this.partialCommitsCounter = Counter.builder("delayer.moves.partial")
                .description("Topic groups whose move had no effect")
                .register(meterRegistry);

        this.passTimer = Timer.builder("delayer.pass.time")
                .description("Duration of a promotion pass")
                .register(meterRegistry);

        log.info("TimerMetricsService initialized with Micrometer metrics");
    }

    public void recordPass(long durationMs) {
        passesCounter.increment();
        passTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordPassAborted() {
        passesAbortedCounter.increment();
    }

    public void recordPromoted(int jobs) {
        jobsPromotedCounter.increment(jobs);
    }

    public void recordOrphaned() {
        jobsOrphanedCounter.increment();
    }

    public void recordLookupFailed() {
        lookupsFailedCounter.increment();
    }

    public void recordMoveFailed() {
        movesFailedCounter.increment();
    }

    public void recordPartialCommit() {
        partialCommitsCounter.increment();
    }
}
