package com.roomsnap.collab.network;

/**
 * Runs delayed and recurring work for the transport link and the session
 * lifecycle, so both can be driven by a manual clock in tests.
 */
public interface TaskScheduler {
    
    /**
     * Handle of a scheduled task.
     */
    interface Cancellable {
        void cancel();
    }
    
    Cancellable schedule(Runnable task, long delayMillis);
    
    Cancellable scheduleAtFixedRate(Runnable task, long periodMillis);
    
    void shutdown();
}
