package com.roomsnap.collab.event;

import com.roomsnap.collab.error.ConnectionLostException;
import com.roomsnap.collab.model.Annotation;
import com.roomsnap.collab.model.ChatMessage;
import com.roomsnap.collab.model.CursorPosition;
import com.roomsnap.collab.model.Participant;
import com.roomsnap.collab.model.SharedMeasurement;
import com.roomsnap.collab.session.Session;

/**
 * The events published by the collaboration engine.
 */
public final class SessionEvents {
    public static final EventKey<Participant> PARTICIPANT_JOINED =
            new EventKey<>("participantJoined", Participant.class);
    public static final EventKey<Participant> PARTICIPANT_LEFT =
            new EventKey<>("participantLeft", Participant.class);
    public static final EventKey<SharedMeasurement> MEASUREMENT_SHARED =
            new EventKey<>("measurementShared", SharedMeasurement.class);
    public static final EventKey<SharedMeasurement> MEASUREMENT_UPDATED =
            new EventKey<>("measurementUpdated", SharedMeasurement.class);
    public static final EventKey<Annotation> ANNOTATION_UPDATED =
            new EventKey<>("annotationUpdated", Annotation.class);
    public static final EventKey<CursorPosition> CURSOR_UPDATED =
            new EventKey<>("cursorUpdated", CursorPosition.class);
    public static final EventKey<ChatMessage> CHAT_MESSAGE =
            new EventKey<>("chatMessage", ChatMessage.class);
    /** Payload is a detached snapshot of the session after the overwrite. */
    public static final EventKey<Session> SESSION_SYNCED =
            new EventKey<>("sessionSynced", Session.class);
    public static final EventKey<ConnectionLostException> CONNECTION_LOST =
            new EventKey<>("connectionLost", ConnectionLostException.class);
    
    private SessionEvents() {
    }
}
