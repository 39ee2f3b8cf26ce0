package com.sailfish.backoff.service.impl;

import com.sailfish.backoff.BackoffOperation;
import com.sailfish.backoff.retry.BackoffConfig;
import com.sailfish.backoff.retry.DelaySchedule;
import com.sailfish.backoff.retry.DelayScheduleGenerator;
import com.sailfish.backoff.service.BackoffExecutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of the BackoffExecutionService.
 * Attempts run on the task executor; delays between attempts are timed on the scheduler executor.
 *
 * Stateless across executions: every call builds its own {@link BackoffExecution}, so concurrent
 * callers share nothing but the two pools.
 */
public class BackoffExecutionServiceImpl implements BackoffExecutionService {

    private static final Logger log = LoggerFactory.getLogger(BackoffExecutionServiceImpl.class);

    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final ExecutorService taskExecutor; // Pool the attempts run on
    private final ScheduledExecutorService schedulerExecutor; // Times the delays between attempts
    private final DelayScheduleGenerator scheduleGenerator;

    /**
     * Creates a service owning a cached pool of daemon threads for attempts and a single daemon
     * scheduler thread. Call {@link #shutdown(long)} to release them.
     */
    public BackoffExecutionServiceImpl() {
        this(Executors.newCachedThreadPool(daemonThreads("backoff-attempt")),
                Executors.newSingleThreadScheduledExecutor(daemonThreads("backoff-scheduler")),
                new DelayScheduleGenerator());
    }

    public BackoffExecutionServiceImpl(ExecutorService taskExecutor,
                                       ScheduledExecutorService schedulerExecutor) {
        this(taskExecutor, schedulerExecutor, new DelayScheduleGenerator());
    }

    public BackoffExecutionServiceImpl(ExecutorService taskExecutor,
                                       ScheduledExecutorService schedulerExecutor,
                                       DelayScheduleGenerator scheduleGenerator) {
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor cannot be null");
        this.schedulerExecutor = Objects.requireNonNull(schedulerExecutor, "schedulerExecutor cannot be null");
        this.scheduleGenerator = Objects.requireNonNull(scheduleGenerator, "scheduleGenerator cannot be null");
        log.info("BackoffExecutionService initialized.");
    }

    @Override
    public <T> CompletableFuture<T> executeWithBackoff(BackoffOperation<T> operation, BackoffConfig config) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(config, "config cannot be null");

        // The schedule is computed once and consumed by this execution only
        DelaySchedule schedule = scheduleGenerator.generate(config);
        log.trace("Computed delay schedule {}", schedule);
        return new BackoffExecution<>(operation, config, schedule, taskExecutor, schedulerExecutor).start();
    }

    @Override
    public DelaySchedule computeDelaySchedule(BackoffConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return scheduleGenerator.generate(config);
    }

    /**
     * Container shutdown hook; shuts both pools down with {@link #DEFAULT_SHUTDOWN_TIMEOUT_SECONDS}.
     */
    @PreDestroy
    public void stop() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    @Override
    public void shutdown(long timeoutSeconds) {
        // Timers first: a timer firing during shutdown would dispatch an attempt to a closing pool
        drain("delay scheduler", schedulerExecutor, timeoutSeconds);
        drain("attempt executor", taskExecutor, timeoutSeconds);
    }

    /**
     * Stops the pool from accepting work and waits for outstanding attempts or timers. Anything
     * still queued after the timeout is discarded and the pool is interrupted.
     */
    private void drain(String poolName, ExecutorService pool, long timeoutSeconds) {
        log.info("Draining backoff {}", poolName);
        pool.shutdown();
        try {
            if (pool.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.info("Backoff {} drained.", poolName);
                return;
            }
            List<Runnable> discarded = pool.shutdownNow();
            log.warn("Backoff {} still busy after {}s; interrupted it and discarded {} pending retries.",
                    poolName, timeoutSeconds, discarded.size());
            if (!pool.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.error("Backoff {} ignored the interrupt and is still running.", poolName);
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while draining backoff {}; stopping it immediately.", poolName);
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @PostConstruct
    public void start() {
        if (taskExecutor.isShutdown() || taskExecutor.isTerminated()) {
            throw new IllegalStateException("Task executor is not operational on startup");
        }
        if (schedulerExecutor.isShutdown() || schedulerExecutor.isTerminated()) {
            throw new IllegalStateException("Scheduler executor is not operational on startup");
        }
        log.info("BackoffExecutionService started and ready to accept operations.");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
