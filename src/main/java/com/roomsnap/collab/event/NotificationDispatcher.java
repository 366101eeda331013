package com.roomsnap.collab.event;

/**
 * Outbound, fire-and-forget user notifications (join, leave, session created).
 */
public interface NotificationDispatcher {
    
    void notify(String title, String body);
}
