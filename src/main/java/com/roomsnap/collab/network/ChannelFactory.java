package com.roomsnap.collab.network;

import java.io.IOException;

/**
 * Opens channels to the synchronization endpoint.
 */
public interface ChannelFactory {
    
    /**
     * Opens a channel, blocking until it is connected.
     * @param listener Receives frames and the close notification of the new channel.
     * @return The open channel.
     * @throws IOException if the connection could not be established.
     */
    Channel open(Channel.Listener listener) throws IOException;
}
