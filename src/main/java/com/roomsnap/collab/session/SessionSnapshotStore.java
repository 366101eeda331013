package com.roomsnap.collab.session;

import java.util.List;
import java.util.Optional;

/**
 * Local persistence of session snapshots, keyed by session id.
 */
public interface SessionSnapshotStore {
    
    void save(Session session);
    
    Optional<Session> load(String sessionId);
    
    List<Session> loadAll();
    
    void remove(String sessionId);
}
