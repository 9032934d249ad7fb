package com.roof.measurement.config;

import com.roof.measurement.exception.ParallelMeasurementUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import jakarta.annotation.PreDestroy;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Executor for the all-sources mode, which queries every automated source concurrently.
 * The tiered waterfall never uses it.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ParallelMeasurementConfig {

    private final MeasurementProperties measurementProperties;

    // Keep reference to executor for graceful shutdown
    private ThreadPoolTaskExecutor measurementExecutor;

    /**
     * Bounded pool; a full queue rejects the whole all-sources request instead of queueing
     * provider calls past the request deadline.
     */
    @Bean(name = "measurementExecutor")
    public ThreadPoolTaskExecutor measurementExecutor() {
        MeasurementProperties.Parallel parallel = measurementProperties.getParallel();

        measurementExecutor = new ThreadPoolTaskExecutor();
        measurementExecutor.setCorePoolSize(parallel.getWorkers());
        measurementExecutor.setMaxPoolSize(parallel.getWorkers());
        measurementExecutor.setQueueCapacity(parallel.getQueueCapacity());
        measurementExecutor.setThreadNamePrefix("measurement-source-");
        measurementExecutor.setKeepAliveSeconds(60);
        measurementExecutor.setAllowCoreThreadTimeOut(true);
        measurementExecutor.setRejectedExecutionHandler(new MeasurementRejectedExecutionHandler());
        measurementExecutor.setWaitForTasksToCompleteOnShutdown(true);
        measurementExecutor.setAwaitTerminationSeconds(30);
        measurementExecutor.initialize();

        log.info("Initialized measurement executor - workers: {}, queueCapacity: {}",
            parallel.getWorkers(), parallel.getQueueCapacity());

        return measurementExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (measurementExecutor != null) {
            ThreadPoolExecutor executor = measurementExecutor.getThreadPoolExecutor();
            log.info("Shutting down measurement executor - Queue size: {}, Active threads: {}",
                executor.getQueue().size(), executor.getActiveCount());

            try {
                measurementExecutor.shutdown();

                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Measurement tasks did not complete within 30 seconds, forcing shutdown");
                    executor.shutdownNow();
                } else {
                    log.info("Measurement executor shutdown completed gracefully");
                }
            } catch (InterruptedException e) {
                log.warn("Shutdown interrupted, forcing immediate termination");
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Called when the pool and queue are both full.
     */
    private static class MeasurementRejectedExecutionHandler implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Measurement queue is full - rejecting task. Active threads: {}, Queue size: {}, Pool size: {}",
                executor.getActiveCount(), executor.getQueue().size(), executor.getPoolSize());

            throw new ParallelMeasurementUnavailableException("All-sources measurement queue is full. "
                + "Active threads: " + executor.getActiveCount()
                + ", Queue size: " + executor.getQueue().size());
        }
    }
}
