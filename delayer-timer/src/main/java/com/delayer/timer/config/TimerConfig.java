package com.delayer.timer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for the timer loop and the stages of a pass.
 */
@Configuration
public class TimerConfig {

    @Value("${delayer.timer.pass-threads:4}")
    private int passThreadCount;

    @Value("${delayer.timer.lookup-threads:16}")
    private int lookupThreadCount;

    @Value("${delayer.timer.move-threads:8}")
    private int moveThreadCount;

    @Bean(name = "timerExecutorService")
    public ScheduledExecutorService timerExecutorService() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("DelayerTimer-", true));
    }

    /**
     * Runs whole passes. Sized above one so a slow pass does not hold back the next tick.
     * Has no work queue: a tick that finds every pass thread busy is rejected, not queued.
     */
    @Bean(name = "passExecutorService")
    public ExecutorService passExecutorService() {
        return new ThreadPoolExecutor(passThreadCount, passThreadCount,
                0L, TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(),
                namedThreads("DelayerPass-", false),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "lookupExecutorService")
    public ExecutorService lookupExecutorService() {
        return Executors.newFixedThreadPool(lookupThreadCount, namedThreads("TopicLookup-", false));
    }

    @Bean(name = "moveExecutorService")
    public ExecutorService moveExecutorService() {
        return Executors.newFixedThreadPool(moveThreadCount, namedThreads("QueueMove-", false));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadFactory namedThreads(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread thread = new Thread(r);
            thread.setName(prefix + counter.getAndIncrement());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
