package com.roomsnap.collab.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default dispatcher for hosts without a notification service.
 */
public class LoggingNotificationDispatcher implements NotificationDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);
    
    @Override
    public void notify(String title, String body) {
        LOGGER.info("{}: {}", title, body);
    }
}
