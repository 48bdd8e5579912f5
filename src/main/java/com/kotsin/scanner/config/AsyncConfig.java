package com.kotsin.scanner.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

/**
 * AsyncConfig - Thread pools used by the scan loop.
 *
 * Provides:
 * - scanScheduler: single thread that owns tick scheduling
 * - scanExecutor: per-symbol scans within one tick
 * - dispatchExecutor: fire-and-forget delivery of trade signals to sinks
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${scan.executor.pool.size:" + ProcessingConstants.SCAN_POOL_SIZE + "}")
    private int scanPoolSize;

    @Value("${dispatch.executor.pool.size:" + ProcessingConstants.DISPATCH_POOL_SIZE + "}")
    private int dispatchPoolSize;

    @Bean(name = "scanScheduler")
    public ThreadPoolTaskScheduler scanScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("scan-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Executor for per-symbol scans.
     *
     * Uses CallerRunsPolicy: if the queue is full the tick thread scans the symbol itself,
     * so no symbol is skipped, the tick just takes longer.
     */
    @Bean(name = "scanExecutor")
    public Executor scanExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(scanPoolSize);
        executor.setMaxPoolSize(scanPoolSize);
        executor.setQueueCapacity(ProcessingConstants.QUEUE_CAPACITY);
        executor.setThreadNamePrefix("scan-worker-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("[SCAN-EXECUTOR] Queue full, executing in caller thread. activeCount={}, queueSize={}",
                    e.getActiveCount(), e.getQueue().size());
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) ProcessingConstants.SHUTDOWN_TIMEOUT.toSeconds());
        executor.initialize();

        log.info("[SCAN-EXECUTOR] Initialized: poolSize={}, queueCapacity={}",
                scanPoolSize, ProcessingConstants.QUEUE_CAPACITY);
        return executor;
    }

    /**
     * Executor for signal delivery. A full queue drops the delivery with a warning;
     * the scan loop never blocks on a slow sink.
     */
    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatchPoolSize);
        executor.setMaxPoolSize(dispatchPoolSize);
        executor.setQueueCapacity(ProcessingConstants.QUEUE_CAPACITY);
        executor.setThreadNamePrefix("signal-dispatch-");
        executor.setRejectedExecutionHandler((r, e) ->
                log.warn("[DISPATCH-EXECUTOR] Signal delivery rejected - queue full"));
        executor.initialize();
        log.info("[DISPATCH-EXECUTOR] Initialized: poolSize={}", dispatchPoolSize);
        return executor;
    }
}
