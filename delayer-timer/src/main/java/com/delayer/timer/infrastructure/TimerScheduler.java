package com.delayer.timer.infrastructure;

import com.delayer.timer.domain.PassReport;
import com.delayer.timer.service.PromotionPass;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives promotion passes at a fixed rate.
 * <p>
 * The timer thread only hands each tick's pass to the pass pool, so a slow pass never
 * delays the next tick and passes may overlap. Ticks are never queued: when every pass
 * thread is busy the tick is dropped and counted. {@link #stop()} cancels future ticks
 * but lets in-flight passes finish.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TimerScheduler {

    private final ScheduledExecutorService timerExecutorService;
    private final ExecutorService passExecutorService;
    private final PromotionPass promotionPass;

    @Value("${delayer.timer.interval-ms:1000}")
    private long intervalMs;

    @Value("${delayer.timer.enabled:true}")
    private boolean timerEnabled;

    @Value("${delayer.timer.shutdown-timeout-seconds:30}")
    private long shutdownTimeoutSeconds;

    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong droppedTicks = new AtomicLong();
    private final AtomicLong passesCompleted = new AtomicLong();
    private final AtomicReference<PassReport> lastReport = new AtomicReference<>();

    private ScheduledFuture<?> tickFuture;

    @PostConstruct
    public void init() {
        if (!timerEnabled) {
            log.info("Delayer timer is disabled");
            return;
        }
        start();
    }

    /**
     * Start ticking.
     *
     * @return false if the timer was already running
     */
    public synchronized boolean start() {
        if (isRunning()) {
            return false;
        }
        if (intervalMs <= 0) {
            throw new IllegalStateException("delayer.timer.interval-ms must be positive, was " + intervalMs);
        }

        tickFuture = timerExecutorService.scheduleAtFixedRate(
                this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Delayer timer started with interval {}ms", intervalMs);
        return true;
    }

    /**
     * Stop future ticks. Passes already running are not interrupted.
     *
     * @return false if the timer was not running
     */
    public synchronized boolean stop() {
        if (!isRunning()) {
            return false;
        }
        tickFuture.cancel(false);
        tickFuture = null;
        log.info("Delayer timer stopped");
        return true;
    }

    public synchronized boolean isRunning() {
        return tickFuture != null && !tickFuture.isDone();
    }

    /**
     * Run one pass on the calling thread.
     */
    public PassReport runOnce() {
        PassReport report = promotionPass.execute();
        record(report);
        return report;
    }

    void tick() {
        long tick = ticks.incrementAndGet();
        try {
            passExecutorService.execute(this::runPass);
        } catch (RejectedExecutionException e) {
            // An exception escaping here would cancel the schedule
            if (passExecutorService.isShutdown()) {
                log.debug("Pass for tick {} rejected, pass pool is shut down", tick);
            } else {
                droppedTicks.incrementAndGet();
                log.warn("Dropping tick {}: all pass threads are busy", tick);
            }
        }
    }

    private void runPass() {
        try {
            record(promotionPass.execute());
        } catch (RuntimeException e) {
            log.error("Promotion pass failed unexpectedly: {}", e.getMessage(), e);
        }
    }

    private void record(PassReport report) {
        passesCompleted.incrementAndGet();
        lastReport.set(report);
    }

    public long getTicks() {
        return ticks.get();
    }

    public long getDroppedTicks() {
        return droppedTicks.get();
    }

    public long getPassesCompleted() {
        return passesCompleted.get();
    }

    public PassReport getLastReport() {
        return lastReport.get();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down delayer timer...");

        stop();
        timerExecutorService.shutdownNow();

        // In-flight passes run to completion
        passExecutorService.shutdown();
        try {
            if (!passExecutorService.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Passes did not finish within {}s, forcing shutdown", shutdownTimeoutSeconds);
                passExecutorService.shutdownNow();
            } else {
                log.info("All passes finished");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for passes to finish", e);
            passExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
