package com.roomsnap.collab.testing;

import com.roomsnap.collab.network.TaskScheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs scheduled tasks only when virtual time is advanced.
 */
public class ManualScheduler implements TaskScheduler {
    private final List<ScheduledTask> tasks = new ArrayList<>();
    private final List<Long> requestedDelays = new ArrayList<>();
    private long now;
    private boolean shutdown;
    
    @Override
    public synchronized Cancellable schedule(Runnable task, long delayMillis) {
        requestedDelays.add(delayMillis);
        ScheduledTask scheduled = new ScheduledTask(task, now + delayMillis, 0);
        tasks.add(scheduled);
        return scheduled;
    }
    
    @Override
    public synchronized Cancellable scheduleAtFixedRate(Runnable task, long periodMillis) {
        ScheduledTask scheduled = new ScheduledTask(task, now + periodMillis, periodMillis);
        tasks.add(scheduled);
        return scheduled;
    }
    
    @Override
    public synchronized void shutdown() {
        shutdown = true;
        tasks.clear();
    }
    
    /**
     * Moves virtual time forward, running every task that falls due.
     * @param millis How far to move.
     */
    public void advance(long millis) {
        long target;
        synchronized (this) {
            target = now + millis;
        }
        while (true) {
            ScheduledTask next;
            synchronized (this) {
                next = earliestDue(target);
                if (next == null) {
                    now = target;
                    return;
                }
                now = next.dueAt;
                if (next.periodMillis > 0) {
                    next.dueAt += next.periodMillis;
                } else {
                    tasks.remove(next);
                }
            }
            next.task.run();
        }
    }
    
    /**
     * Runs the earliest one-shot task, moving time to its due point.
     * @return false if there was none.
     */
    public boolean runNextOneShot() {
        long due = -1;
        synchronized (this) {
            for (ScheduledTask task : tasks) {
                if (task.periodMillis == 0 && (due < 0 || task.dueAt < due)) {
                    due = task.dueAt;
                }
            }
            if (due < 0) {
                return false;
            }
        }
        advance(due - now);
        return true;
    }
    
    public synchronized List<Long> requestedDelays() {
        return new ArrayList<>(requestedDelays);
    }
    
    public synchronized int pendingOneShots() {
        int count = 0;
        for (ScheduledTask task : tasks) {
            if (task.periodMillis == 0) {
                count++;
            }
        }
        return count;
    }
    
    public synchronized int periodicTasks() {
        int count = 0;
        for (ScheduledTask task : tasks) {
            if (task.periodMillis > 0) {
                count++;
            }
        }
        return count;
    }
    
    public synchronized boolean isShutdown() {
        return shutdown;
    }
    
    private ScheduledTask earliestDue(long limit) {
        ScheduledTask earliest = null;
        for (ScheduledTask task : tasks) {
            if (task.dueAt <= limit && (earliest == null || task.dueAt < earliest.dueAt)) {
                earliest = task;
            }
        }
        return earliest;
    }
    
    private final class ScheduledTask implements Cancellable {
        private final Runnable task;
        private final long periodMillis;
        private long dueAt;
        
        private ScheduledTask(Runnable task, long dueAt, long periodMillis) {
            this.task = task;
            this.dueAt = dueAt;
            this.periodMillis = periodMillis;
        }
        
        @Override
        public void cancel() {
            synchronized (ManualScheduler.this) {
                tasks.remove(this);
            }
        }
    }
}
