package com.roomsnap.collab;

import com.google.gson.JsonElement;
import com.roomsnap.collab.error.CollaborationException;
import com.roomsnap.collab.error.ConnectionLostException;
import com.roomsnap.collab.error.MessageDecodingException;
import com.roomsnap.collab.error.PermissionDeniedException;
import com.roomsnap.collab.event.EventBus;
import com.roomsnap.collab.event.LoggingNotificationDispatcher;
import com.roomsnap.collab.event.NotificationDispatcher;
import com.roomsnap.collab.event.SessionEvents;
import com.roomsnap.collab.model.Annotation;
import com.roomsnap.collab.model.AnnotationStyle;
import com.roomsnap.collab.model.AnnotationType;
import com.roomsnap.collab.model.ChatMessage;
import com.roomsnap.collab.model.CursorPosition;
import com.roomsnap.collab.model.MeasurementDraft;
import com.roomsnap.collab.model.MeasurementUpdate;
import com.roomsnap.collab.model.Participant;
import com.roomsnap.collab.model.Point3;
import com.roomsnap.collab.model.Role;
import com.roomsnap.collab.model.SessionSettings;
import com.roomsnap.collab.model.SharedMeasurement;
import com.roomsnap.collab.model.UserIdentity;
import com.roomsnap.collab.network.ChannelFactory;
import com.roomsnap.collab.network.CollaborationMessage;
import com.roomsnap.collab.network.ExecutorTaskScheduler;
import com.roomsnap.collab.network.LinkState;
import com.roomsnap.collab.network.MessageCodec;
import com.roomsnap.collab.network.MessageType;
import com.roomsnap.collab.network.OutboundMessenger;
import com.roomsnap.collab.network.OutboundQueue;
import com.roomsnap.collab.network.RemoteRoomDirectory;
import com.roomsnap.collab.network.SyncPayload;
import com.roomsnap.collab.network.TaskScheduler;
import com.roomsnap.collab.network.TransportLink;
import com.roomsnap.collab.network.WebSocketChannelFactory;
import com.roomsnap.collab.session.ConflictResolver;
import com.roomsnap.collab.session.CursorThrottle;
import com.roomsnap.collab.session.FileSessionSnapshotStore;
import com.roomsnap.collab.session.MeasurementApplyResult;
import com.roomsnap.collab.session.RoomDirectory;
import com.roomsnap.collab.session.Session;
import com.roomsnap.collab.session.SessionLifecycleManager;
import com.roomsnap.collab.session.SessionSnapshotStore;
import com.roomsnap.collab.session.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The collaboration engine of one local participant.
 * <p>
 * Wires the transport link, the session state store, the conflict resolver,
 * the lifecycle manager and the event bus together, applies inbound
 * envelopes and exposes the local collaboration operations. Every entry
 * point runs under the monitor of the session state store.
 */
public class CollaborationEngine implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CollaborationEngine.class);
    
    private final UserIdentity identity;
    private final Clock clock;
    private final MessageCodec codec;
    private final TransportLink link;
    private final TaskScheduler scheduler;
    private final SessionStateStore store;
    private final OutboundMessenger messenger;
    private final SessionLifecycleManager lifecycle;
    private final CursorThrottle cursorThrottle;
    private final EventBus events = new EventBus();
    private final NotificationDispatcher notifications;
    private final Map<String, Long> lastSequenceByParticipant = new HashMap<>();
    
    private CollaborationEngine(Builder builder) {
        this.identity = builder.identity;
        this.clock = builder.clock;
        this.codec = new MessageCodec();
        this.scheduler = builder.scheduler != null
                ? builder.scheduler : new ExecutorTaskScheduler("collab-sync-" + identity.getUserId());
        ChannelFactory channelFactory = builder.channelFactory != null
                ? builder.channelFactory
                : new WebSocketChannelFactory(builder.config.getServerUri(), builder.config.getConnectTimeoutMillis());
        this.link = new TransportLink(channelFactory, codec, new OutboundQueue(), scheduler,
                builder.config.getMaxReconnectAttempts(), builder.config.getReconnectBaseDelayMillis());
        this.store = new SessionStateStore(clock);
        ConflictResolver resolver = new ConflictResolver(store);
        this.messenger = new OutboundMessenger(link, codec, clock);
        this.notifications = builder.notifications != null
                ? builder.notifications : new LoggingNotificationDispatcher();
        
        RoomDirectory directory = builder.roomDirectory != null
                ? builder.roomDirectory
                : new RemoteRoomDirectory(messenger, identity.participantId(), builder.config.getJoinTimeoutMillis());
        SessionSnapshotStore snapshots = builder.snapshotStore != null
                ? builder.snapshotStore : new FileSessionSnapshotStore(builder.config.getSnapshotDirectory());
        this.lifecycle = new SessionLifecycleManager(identity, store, resolver, messenger, directory, snapshots,
                scheduler, notifications, clock, builder.config.getSyncIntervalMillis());
        this.cursorThrottle = new CursorThrottle(clock, builder.config.getCursorThrottleMillis());
        lifecycle.setResolvedListener(winner -> events.emit(SessionEvents.MEASUREMENT_UPDATED, winner));
        
        link.addMessageListener(this::handleMessage);
        link.addStateListener(this::handleLinkState);
    }
    
    public static Builder builder(UserIdentity identity) {
        return new Builder(identity);
    }
    
    /**
     * Connects to the relay server and resumes the newest live local snapshot.
     * @return The resumed session, if any.
     */
    public Optional<Session> start() {
        boolean connected = link.connect();
        LOGGER.info("Collaboration engine for {} started ({})", identity.participantId(),
                connected ? "connected" : "offline, retrying");
        return lifecycle.resumeSavedSession();
    }
    
    public Session createSession() {
        return createSession(null);
    }
    
    /**
     * Creates a session hosted by the local participant.
     * @param settings The settings, or null for the defaults.
     * @return A snapshot of the new session.
     */
    public Session createSession(SessionSettings settings) {
        Session created = lifecycle.createSession(settings);
        resetInboundTracking();
        return created;
    }
    
    /**
     * Joins a session by room code.
     * @param roomCode The room code.
     * @return A snapshot of the joined session.
     * @throws CollaborationException if the room is unknown, expired or full,
     *         or the server cannot be reached.
     */
    public Session joinSession(String roomCode) throws CollaborationException {
        Session joined = lifecycle.joinSession(roomCode);
        resetInboundTracking();
        return joined;
    }
    
    public void leaveSession() {
        synchronized (store) {
            lifecycle.leaveSession();
            lastSequenceByParticipant.clear();
            cursorThrottle.reset();
        }
    }
    
    /**
     * Shares a measurement computed locally.
     * @param draft The measured geometry.
     * @return The shared measurement.
     * @throws PermissionDeniedException if the local participant may not edit.
     */
    public SharedMeasurement shareMeasurement(MeasurementDraft draft) throws PermissionDeniedException {
        synchronized (store) {
            Session session = requireSession();
            Participant self = requireEditor(session);
            if (draft.getId() != null && store.measurement(draft.getId()).isPresent()) {
                return updateMeasurement(draft.getId(), draft.asUpdate());
            }
            
            String id = draft.getId() != null ? draft.getId() : "measurement_" + UUID.randomUUID();
            SharedMeasurement measurement = new SharedMeasurement(id, self.getId(), draft.getPoints(),
                    draft.getDistance(), draft.getUnit(), draft.getLabel(), clock.millis(), 1, false);
            store.addLocalMeasurement(measurement);
            messenger.send(MessageType.MEASUREMENT, session.getId(), self.getId(), measurement);
            lifecycle.persist();
            events.emit(SessionEvents.MEASUREMENT_SHARED, measurement);
            return measurement;
        }
    }
    
    /**
     * Edits a shared measurement and broadcasts the new version.
     * @param measurementId The measurement.
     * @param update The fields to change.
     * @return The measurement at its new version.
     * @throws PermissionDeniedException if the local participant may not edit,
     *         or the measurement is locked and the local participant is not host.
     */
    public SharedMeasurement updateMeasurement(String measurementId, MeasurementUpdate update)
            throws PermissionDeniedException {
        synchronized (store) {
            Session session = requireSession();
            Participant self = requireEditor(session);
            SharedMeasurement updated = store.updateLocalMeasurement(measurementId, update, self.getRole());
            messenger.send(MessageType.MEASUREMENT, session.getId(), self.getId(), updated);
            lifecycle.persist();
            events.emit(SessionEvents.MEASUREMENT_UPDATED, updated);
            return updated;
        }
    }
    
    public SharedMeasurement setMeasurementLocked(String measurementId, boolean locked)
            throws PermissionDeniedException {
        synchronized (store) {
            Session session = requireSession();
            Participant self = requireSelf(session);
            SharedMeasurement updated = store.setLocked(measurementId, locked, self.getRole());
            messenger.send(MessageType.MEASUREMENT, session.getId(), self.getId(), updated);
            lifecycle.persist();
            events.emit(SessionEvents.MEASUREMENT_UPDATED, updated);
            return updated;
        }
    }
    
    /**
     * Places an annotation in the shared space.
     * @param type The annotation shape.
     * @param position Where it is anchored.
     * @param content Its text, if any.
     * @param style Its style, or null; missing fields take the participant's defaults.
     * @return The new annotation.
     * @throws PermissionDeniedException if the local participant may not edit.
     */
    public Annotation addAnnotation(AnnotationType type, Point3 position, String content, AnnotationStyle style)
            throws PermissionDeniedException {
        synchronized (store) {
            Session session = requireSession();
            Participant self = requireEditor(session);
            AnnotationStyle defaults = AnnotationStyle.defaultFor(self.getColor());
            AnnotationStyle effective = style != null ? style.withDefaults(defaults) : defaults;
            
            Annotation annotation = new Annotation("annotation_" + UUID.randomUUID(), self.getId(), type,
                    position, content == null ? "" : content, effective, clock.millis());
            store.putAnnotation(annotation);
            messenger.send(MessageType.ANNOTATION, session.getId(), self.getId(), annotation);
            lifecycle.persist();
            events.emit(SessionEvents.ANNOTATION_UPDATED, annotation);
            return annotation;
        }
    }
    
    /**
     * Broadcasts the local cursor, at most once per throttle interval.
     * @param position The cursor position.
     * @return true if the update was sent, false if it was throttled.
     */
    public boolean updateCursor(Point3 position) {
        synchronized (store) {
            Session session = requireSession();
            if (!cursorThrottle.tryAcquire()) {
                return false;
            }
            CursorPosition cursor = new CursorPosition(identity.participantId(), position, clock.millis());
            store.putCursor(cursor);
            messenger.send(MessageType.CURSOR, session.getId(), cursor.getParticipantId(), cursor);
            return true;
        }
    }
    
    public ChatMessage sendChatMessage(String text) {
        synchronized (store) {
            Session session = requireSession();
            Participant self = requireSelf(session);
            ChatMessage chat = new ChatMessage(text, self.getName(), self.getColor());
            messenger.send(MessageType.CHAT, session.getId(), self.getId(), chat);
            events.emit(SessionEvents.CHAT_MESSAGE, chat);
            return chat;
        }
    }
    
    public Optional<Session> currentSession() {
        return store.snapshot();
    }
    
    public Optional<Participant> currentParticipant() {
        return lifecycle.currentParticipant();
    }
    
    public boolean isHost() {
        return currentParticipant().map(p -> p.getRole() == Role.HOST).orElse(false);
    }
    
    public boolean canEdit() {
        synchronized (store) {
            Optional<Session> session = store.snapshot();
            Optional<Participant> self = currentParticipant();
            return session.isPresent() && self.isPresent() && mayEdit(session.get(), self.get());
        }
    }
    
    public EventBus events() {
        return events;
    }
    
    public LinkState linkState() {
        return link.getState();
    }
    
    public UserIdentity getIdentity() {
        return identity;
    }
    
    /**
     * Leaves the active session, closes the connection and releases the
     * scheduler and all subscriptions.
     */
    @Override
    public void close() {
        leaveSession();
        link.disconnect();
        scheduler.shutdown();
        events.clear();
        LOGGER.info("Collaboration engine for {} closed", identity.participantId());
    }
    
    private void handleMessage(CollaborationMessage message) {
        if (message.getType().isDirectoryControl()) {
            return;
        }
        synchronized (store) {
            Optional<Session> active = store.snapshot();
            if (active.isEmpty() || !active.get().getId().equals(message.getSessionId())) {
                LOGGER.debug("Ignoring {} for inactive session {}", message.getType().wireName(), message.getSessionId());
                return;
            }
            if (identity.participantId().equals(message.getParticipantId())) {
                return;
            }
            if (!acceptSequence(message)) {
                LOGGER.debug("Dropping duplicate {} #{} from {}", message.getType().wireName(),
                        message.getSequence(), message.getParticipantId());
                return;
            }
            
            try {
                apply(active.get(), message);
            } catch (MessageDecodingException e) {
                LOGGER.warn("Dropping {} from {}: {}", message.getType().wireName(),
                        message.getParticipantId(), e.getMessage());
            }
        }
    }
    
    private void apply(Session session, CollaborationMessage message) throws MessageDecodingException {
        JsonElement data = message.getData();
        switch (message.getType()) {
            case JOIN:
                handleJoin(message, data);
                break;
            case LEAVE:
                store.markInactive(message.getParticipantId()).ifPresent(left -> {
                    events.emit(SessionEvents.PARTICIPANT_LEFT, left);
                    dispatch("Participant Left", left.getName() + " left the session");
                });
                break;
            case MEASUREMENT:
                handleMeasurement(codec.fromPayload(data, SharedMeasurement.class));
                break;
            case ANNOTATION:
                Annotation annotation = codec.fromPayload(data, Annotation.class);
                if (store.putAnnotation(annotation)) {
                    events.emit(SessionEvents.ANNOTATION_UPDATED, annotation);
                }
                break;
            case CURSOR:
                CursorPosition cursor = codec.fromPayload(data, CursorPosition.class);
                if (store.putCursor(cursor)) {
                    events.emit(SessionEvents.CURSOR_UPDATED, cursor);
                }
                break;
            case SYNC:
                SyncPayload sync = codec.fromPayload(data, SyncPayload.class);
                if (store.replaceContent(sync.getMeasurements(), sync.getAnnotations())) {
                    store.snapshot().ifPresent(synced -> events.emit(SessionEvents.SESSION_SYNCED, synced));
                }
                break;
            case CHAT:
                events.emit(SessionEvents.CHAT_MESSAGE, codec.fromPayload(data, ChatMessage.class));
                break;
            default:
                LOGGER.debug("No handler for {} in session {}", message.getType().wireName(), session.getId());
        }
    }
    
    private void handleJoin(CollaborationMessage message, JsonElement data) throws MessageDecodingException {
        Participant joined;
        if (data.isJsonObject() && data.getAsJsonObject().has("roomCode")) {
            Session announced = codec.fromPayload(data, Session.class);
            Optional<Participant> announcer = announced.findParticipant(message.getParticipantId());
            if (announcer.isEmpty()) {
                LOGGER.warn("Session announcement from {} does not list its sender", message.getParticipantId());
                return;
            }
            joined = announcer.get();
        } else {
            joined = codec.fromPayload(data, Participant.class);
        }
        
        try {
            Participant stored = store.putParticipant(joined);
            events.emit(SessionEvents.PARTICIPANT_JOINED, stored);
            dispatch("Participant Joined", stored.getName() + " joined the session");
        } catch (IllegalStateException e) {
            LOGGER.warn("Rejected join from {}: {}", joined.getId(), e.getMessage());
        }
    }
    
    private void handleMeasurement(SharedMeasurement incoming) {
        MeasurementApplyResult result = store.applyRemoteMeasurement(incoming);
        switch (result) {
            case ADDED:
            case APPLIED:
                events.emit(SessionEvents.MEASUREMENT_UPDATED, incoming);
                break;
            case CONFLICT_QUEUED:
                // settled by the next sync tick so rebroadcasts stay bounded by the sync interval
                LOGGER.debug("Measurement {} v{} queued for the next resolver pass",
                        incoming.getId(), incoming.getVersion());
                break;
            default:
                LOGGER.debug("Measurement {} v{}: {}", incoming.getId(), incoming.getVersion(), result);
        }
    }
    
    private boolean acceptSequence(CollaborationMessage message) {
        String sender = message.getParticipantId();
        if (message.getType() == MessageType.JOIN) {
            lastSequenceByParticipant.put(sender, message.getSequence());
            return true;
        }
        Long last = lastSequenceByParticipant.get(sender);
        if (last != null && message.getSequence() <= last) {
            return false;
        }
        lastSequenceByParticipant.put(sender, message.getSequence());
        return true;
    }
    
    private void handleLinkState(LinkState state) {
        if (state == LinkState.CONNECTED) {
            if (lifecycle.syncNow()) {
                LOGGER.info("Re-synchronised session after reconnect");
            }
        } else if (state == LinkState.CONNECTION_LOST) {
            LOGGER.error("Connection to the collaboration server lost");
            events.emit(SessionEvents.CONNECTION_LOST,
                    new ConnectionLostException("Connection to the collaboration server lost"));
        }
    }
    
    private void resetInboundTracking() {
        synchronized (store) {
            lastSequenceByParticipant.clear();
            cursorThrottle.reset();
        }
    }
    
    private Session requireSession() {
        return store.snapshot().orElseThrow(() -> new IllegalStateException("No active session"));
    }
    
    private Participant requireSelf(Session session) {
        return session.findParticipant(identity.participantId())
                .orElseThrow(() -> new IllegalStateException("Local participant missing from session " + session.getId()));
    }
    
    private Participant requireEditor(Session session) throws PermissionDeniedException {
        Participant self = requireSelf(session);
        if (!mayEdit(session, self)) {
            throw new PermissionDeniedException(self.getName() + " may not edit session " + session.getId());
        }
        return self;
    }
    
    private static boolean mayEdit(Session session, Participant participant) {
        if (participant.getRole() == Role.HOST) {
            return true;
        }
        return participant.getRole().canEdit() && session.getSettings().isAllowEditing();
    }
    
    private void dispatch(String title, String body) {
        try {
            notifications.notify(title, body);
        } catch (RuntimeException e) {
            LOGGER.warn("Notification '{}' failed: {}", title, e.getMessage());
        }
    }
    
    /**
     * Assembles an engine. Collaborators left unset are built from the
     * {@link SyncConfig}.
     */
    public static class Builder {
        private final UserIdentity identity;
        private SyncConfig config = SyncConfig.builder().build();
        private Clock clock = Clock.systemUTC();
        private ChannelFactory channelFactory;
        private TaskScheduler scheduler;
        private RoomDirectory roomDirectory;
        private SessionSnapshotStore snapshotStore;
        private NotificationDispatcher notifications;
        
        private Builder(UserIdentity identity) {
            if (identity == null) {
                throw new IllegalArgumentException("identity is required");
            }
            this.identity = identity;
        }
        
        public Builder config(SyncConfig config) {
            this.config = config;
            return this;
        }
        
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }
        
        public Builder channelFactory(ChannelFactory channelFactory) {
            this.channelFactory = channelFactory;
            return this;
        }
        
        public Builder scheduler(TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }
        
        public Builder roomDirectory(RoomDirectory roomDirectory) {
            this.roomDirectory = roomDirectory;
            return this;
        }
        
        public Builder snapshotStore(SessionSnapshotStore snapshotStore) {
            this.snapshotStore = snapshotStore;
            return this;
        }
        
        public Builder notifications(NotificationDispatcher notifications) {
            this.notifications = notifications;
            return this;
        }
        
        public CollaborationEngine build() {
            return new CollaborationEngine(this);
        }
    }
}
