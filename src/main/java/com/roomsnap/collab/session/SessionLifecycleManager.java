package com.roomsnap.collab.session;

import com.roomsnap.collab.error.CapacityExceededException;
import com.roomsnap.collab.error.CollaborationException;
import com.roomsnap.collab.error.SessionNotFoundException;
import com.roomsnap.collab.event.NotificationDispatcher;
import com.roomsnap.collab.model.Participant;
import com.roomsnap.collab.model.Role;
import com.roomsnap.collab.model.SessionSettings;
import com.roomsnap.collab.model.SharedMeasurement;
import com.roomsnap.collab.model.UserIdentity;
import com.roomsnap.collab.network.MessageType;
import com.roomsnap.collab.network.OutboundMessenger;
import com.roomsnap.collab.network.SyncPayload;
import com.roomsnap.collab.network.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Creates, joins, resumes and leaves sessions for the local participant.
 * <p>
 * All state changes happen under the monitor of the {@link SessionStateStore},
 * which is the single lock shared with inbound message handling.
 */
public class SessionLifecycleManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionLifecycleManager.class);
    
    private final UserIdentity identity;
    private final SessionStateStore store;
    private final ConflictResolver resolver;
    private final OutboundMessenger messenger;
    private final RoomDirectory roomDirectory;
    private final SessionSnapshotStore snapshots;
    private final TaskScheduler scheduler;
    private final NotificationDispatcher notifications;
    private final Clock clock;
    private final long syncIntervalMillis;
    
    private TaskScheduler.Cancellable syncTimer;
    private Consumer<SharedMeasurement> resolvedListener = winner -> { };
    
    public SessionLifecycleManager(UserIdentity identity, SessionStateStore store, ConflictResolver resolver,
                                   OutboundMessenger messenger, RoomDirectory roomDirectory,
                                   SessionSnapshotStore snapshots, TaskScheduler scheduler,
                                   NotificationDispatcher notifications, Clock clock, long syncIntervalMillis) {
        this.identity = identity;
        this.store = store;
        this.resolver = resolver;
        this.messenger = messenger;
        this.roomDirectory = roomDirectory;
        this.snapshots = snapshots;
        this.scheduler = scheduler;
        this.notifications = notifications;
        this.clock = clock;
        this.syncIntervalMillis = syncIntervalMillis;
    }
    
    /**
     * Sets the callback told about each measurement the resolver pass raises.
     */
    public void setResolvedListener(Consumer<SharedMeasurement> listener) {
        this.resolvedListener = listener;
    }
    
    /**
     * Creates a new session hosted by the local participant.
     * Any session already active is left first.
     * @param settings The session settings, or null for the defaults.
     * @return A snapshot of the new session.
     */
    public Session createSession(SessionSettings settings) {
        SessionSettings effective = settings != null ? settings : SessionSettings.defaults();
        synchronized (store) {
            leaveSession();
            
            long now = clock.millis();
            Session session = new Session("session_" + UUID.randomUUID(), RoomCodes.generate(),
                    identity.getUserId(), now, effective);
            session.putParticipant(localParticipant(Role.HOST, now));
            store.install(session);
            
            Session created = store.snapshot().orElseThrow();
            snapshots.save(created);
            messenger.send(MessageType.JOIN, created.getId(), identity.participantId(), created);
            startPeriodicSync(created);
            
            LOGGER.info("Created session {} with room code {}", created.getId(), created.getRoomCode());
            dispatch("Session Created", "Room code: " + created.getRoomCode());
            return created;
        }
    }
    
    /**
     * Joins an existing session by room code.
     * @param roomCode The six character room code.
     * @return A snapshot of the joined session.
     * @throws SessionNotFoundException if no live session has that code.
     * @throws com.roomsnap.collab.error.CapacityExceededException if the session is full.
     * @throws com.roomsnap.collab.error.ConnectionLostException if the server cannot be reached.
     */
    public Session joinSession(String roomCode) throws CollaborationException {
        String code = roomCode == null ? "" : roomCode.trim().toUpperCase();
        if (!RoomCodes.isValid(code)) {
            throw new SessionNotFoundException(code);
        }
        
        // Blocks on the network, so it must run outside the store lock
        Session remote = roomDirectory.requestSession(code);
        
        synchronized (store) {
            long now = clock.millis();
            if (remote.isExpired(now)) {
                throw new SessionNotFoundException(code);
            }
            
            String selfId = identity.participantId();
            if (!remote.hasSeatFor(selfId)) {
                throw new CapacityExceededException(code, remote.getSettings().getMaxParticipants());
            }
            
            leaveSession();
            
            Session joined = remote.copy();
            Participant self = joined.findParticipant(selfId)
                    .map(existing -> existing.withPresence(true, now))
                    .orElseGet(() -> localParticipant(Role.EDITOR, now));
            joined.putParticipant(self);
            joined.touch(now);
            store.install(joined);
            
            Session installed = store.snapshot().orElseThrow();
            snapshots.save(installed);
            messenger.send(MessageType.JOIN, installed.getId(), selfId, self);
            sendSync(installed);
            startPeriodicSync(installed);
            
            LOGGER.info("Joined session {} (room {}) as {}", installed.getId(), code, self.getRole());
            dispatch("Joined Session", "Connected to room " + code);
            return installed;
        }
    }
    
    /**
     * Leaves the active session. Does nothing when no session is active.
     */
    public void leaveSession() {
        synchronized (store) {
            Optional<Session> active = store.snapshot();
            if (active.isEmpty()) {
                return;
            }
            Session session = active.get();
            
            messenger.send(MessageType.LEAVE, session.getId(), identity.participantId(), null);
            stopPeriodicSync();
            messenger.getLink().getOutboundQueue().clear();
            messenger.getLink().cancelReconnect();
            store.clear();
            snapshots.remove(session.getId());
            
            LOGGER.info("Left session {}", session.getId());
        }
    }
    
    /**
     * Resumes the most recently updated session found in local snapshots.
     * Expired snapshots are discarded.
     * @return The resumed session, or empty if none was live.
     */
    public Optional<Session> resumeSavedSession() {
        synchronized (store) {
            long now = clock.millis();
            Session newest = null;
            for (Session saved : snapshots.loadAll()) {
                if (saved.isExpired(now)) {
                    LOGGER.info("Discarding expired snapshot of session {}", saved.getId());
                    snapshots.remove(saved.getId());
                    continue;
                }
                if (newest == null || saved.getUpdatedAt() > newest.getUpdatedAt()) {
                    newest = saved;
                }
            }
            if (newest == null) {
                return Optional.empty();
            }
            
            Session resumed = newest.copy();
            Role fallbackRole = identity.getUserId().equals(resumed.getHostId()) ? Role.HOST : Role.EDITOR;
            Participant self = resumed.findParticipant(identity.participantId())
                    .map(existing -> existing.withPresence(true, now))
                    .orElseGet(() -> localParticipant(fallbackRole, now));
            resumed.putParticipant(self);
            store.install(resumed);
            
            Session installed = store.snapshot().orElseThrow();
            snapshots.save(installed);
            messenger.send(MessageType.JOIN, installed.getId(), self.getId(), self);
            startPeriodicSync(installed);
            
            LOGGER.info("Resumed session {} (room {})", installed.getId(), installed.getRoomCode());
            return Optional.of(installed);
        }
    }
    
    /**
     * One periodic sync pass: settles conflicts, broadcasts the full state
     * and refreshes the local snapshot. An expired session is left instead.
     */
    public void syncTick() {
        synchronized (store) {
            Optional<Session> active = store.snapshot();
            if (active.isEmpty()) {
                return;
            }
            if (active.get().isExpired(clock.millis())) {
                LOGGER.info("Session {} expired", active.get().getId());
                leaveSession();
                return;
            }
            
            List<SharedMeasurement> resolved = resolver.resolvePending();
            broadcastResolved(resolved);
            resolved.forEach(resolvedListener);
            Session current = store.snapshot().orElseThrow();
            sendSync(current);
            snapshots.save(current);
        }
    }
    
    /**
     * Sends the full measurements and annotations of the active session.
     * @return false if no session is active.
     */
    public boolean syncNow() {
        synchronized (store) {
            Optional<Session> active = store.snapshot();
            active.ifPresent(this::sendSync);
            return active.isPresent();
        }
    }
    
    /**
     * Re-broadcasts measurements raised by the conflict resolver.
     * @param resolved The measurements at their winning versions.
     */
    public void broadcastResolved(List<SharedMeasurement> resolved) {
        synchronized (store) {
            Optional<Session> active = store.snapshot();
            if (active.isEmpty()) {
                return;
            }
            for (SharedMeasurement measurement : resolved) {
                messenger.send(MessageType.MEASUREMENT, active.get().getId(), identity.participantId(), measurement);
            }
        }
    }
    
    public void persist() {
        synchronized (store) {
            store.snapshot().ifPresent(snapshots::save);
        }
    }
    
    public Optional<Participant> currentParticipant() {
        return store.participant(identity.participantId());
    }
    
    public boolean isSyncing() {
        synchronized (store) {
            return syncTimer != null;
        }
    }
    
    private void sendSync(Session session) {
        messenger.send(MessageType.SYNC, session.getId(), identity.participantId(),
                new SyncPayload(session.getMeasurements(), session.getAnnotations()));
    }
    
    private void startPeriodicSync(Session session) {
        stopPeriodicSync();
        if (!session.getSettings().isAutoSync()) {
            return;
        }
        syncTimer = scheduler.scheduleAtFixedRate(this::syncTick, syncIntervalMillis);
    }
    
    private void stopPeriodicSync() {
        if (syncTimer != null) {
            syncTimer.cancel();
            syncTimer = null;
        }
    }
    
    private Participant localParticipant(Role role, long now) {
        return new Participant(identity.participantId(), identity.getUserId(), identity.getDisplayName(),
                role, ParticipantColors.forUser(identity.getUserId()), true, now, now);
    }
    
    private void dispatch(String title, String body) {
        try {
            notifications.notify(title, body);
        } catch (RuntimeException e) {
            LOGGER.warn("Notification '{}' failed: {}", title, e.getMessage());
        }
    }
}
