package com.roomsnap.collab.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} backed by a single daemon thread.
 */
public class ExecutorTaskScheduler implements TaskScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorTaskScheduler.class);
    
    private final ScheduledExecutorService executor;
    
    public ExecutorTaskScheduler(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }
    
    @Override
    public Cancellable schedule(Runnable task, long delayMillis) {
        try {
            ScheduledFuture<?> future = executor.schedule(guard(task), delayMillis, TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Scheduler is shut down, task not scheduled: {}", e.getMessage());
            return () -> { };
        }
    }
    
    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, long periodMillis) {
        try {
            ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                    guard(task), periodMillis, periodMillis, TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Scheduler is shut down, recurring task not scheduled: {}", e.getMessage());
            return () -> { };
        }
    }
    
    @Override
    public void shutdown() {
        executor.shutdownNow();
    }
    
    // A recurring task that throws would otherwise be silently unscheduled
    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOGGER.error("Scheduled task failed: {}", e.getMessage(), e);
            }
        };
    }
}
