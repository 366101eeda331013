package com.roomsnap.collab.session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps snapshots for the lifetime of the process only.
 */
public class InMemorySessionSnapshotStore implements SessionSnapshotStore {
    private final Map<String, Session> snapshots = new LinkedHashMap<>();
    
    @Override
    public synchronized void save(Session session) {
        snapshots.put(session.getId(), session.copy());
    }
    
    @Override
    public synchronized Optional<Session> load(String sessionId) {
        Session stored = snapshots.get(sessionId);
        return stored == null ? Optional.empty() : Optional.of(stored.copy());
    }
    
    @Override
    public synchronized List<Session> loadAll() {
        List<Session> all = new ArrayList<>();
        for (Session session : snapshots.values()) {
            all.add(session.copy());
        }
        return all;
    }
    
    @Override
    public synchronized void remove(String sessionId) {
        snapshots.remove(sessionId);
    }
}
