package com.roomsnap.collab.network;

/**
 * One open bidirectional text connection to the synchronization endpoint.
 */
public interface Channel {
    
    /**
     * Callbacks from the underlying connection.
     */
    interface Listener {
        void onText(String text);
        
        void onClosed(String reason, boolean remote);
    }
    
    /**
     * Writes one frame.
     * @param text The frame.
     * @return false if the connection refused the write.
     */
    boolean write(String text);
    
    boolean isOpen();
    
    void close();
}
