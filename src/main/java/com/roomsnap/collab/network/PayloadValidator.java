package com.roomsnap.collab.network;

import com.roomsnap.collab.error.MessageDecodingException;
import com.roomsnap.collab.model.Annotation;
import com.roomsnap.collab.model.ChatMessage;
import com.roomsnap.collab.model.CursorPosition;
import com.roomsnap.collab.model.Participant;
import com.roomsnap.collab.model.Role;
import com.roomsnap.collab.model.SessionSettings;
import com.roomsnap.collab.model.SharedMeasurement;
import com.roomsnap.collab.session.Session;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects decoded payloads that lack the fields the session state relies on.
 * Gson fills absent fields with null or zero, so a structurally valid JSON
 * object can still describe an unusable entity.
 */
final class PayloadValidator {

    private PayloadValidator() {
    }

    static void validate(Object payload) throws MessageDecodingException {
        if (payload instanceof SharedMeasurement) {
            validateMeasurement((SharedMeasurement) payload);
        } else if (payload instanceof Participant) {
            validateParticipant((Participant) payload);
        } else if (payload instanceof Annotation) {
            validateAnnotation((Annotation) payload);
        } else if (payload instanceof CursorPosition) {
            validateCursor((CursorPosition) payload);
        } else if (payload instanceof ChatMessage) {
            if (((ChatMessage) payload).getMessage() == null) {
                throw new MessageDecodingException("Chat message without text");
            }
        } else if (payload instanceof SyncPayload) {
            SyncPayload sync = (SyncPayload) payload;
            validateMeasurements(sync.getMeasurements());
            validateAnnotations(sync.getAnnotations());
        } else if (payload instanceof Session) {
            validateSession((Session) payload);
        }
    }

    private static void validateMeasurement(SharedMeasurement measurement) throws MessageDecodingException {
        if (measurement == null) {
            throw new MessageDecodingException("Null measurement");
        }
        requireId(measurement.getId(), "Measurement");
        if (measurement.getVersion() < 1) {
            throw new MessageDecodingException("Measurement " + measurement.getId()
                    + " has invalid version " + measurement.getVersion());
        }
    }

    private static void validateParticipant(Participant participant) throws MessageDecodingException {
        if (participant == null) {
            throw new MessageDecodingException("Null participant");
        }
        requireId(participant.getId(), "Participant");
        if (participant.getRole() == null) {
            throw new MessageDecodingException("Participant " + participant.getId() + " has no known role");
        }
    }

    private static void validateAnnotation(Annotation annotation) throws MessageDecodingException {
        if (annotation == null) {
            throw new MessageDecodingException("Null annotation");
        }
        requireId(annotation.getId(), "Annotation");
        if (annotation.getType() == null) {
            throw new MessageDecodingException("Annotation " + annotation.getId() + " has no known type");
        }
    }

    private static void validateCursor(CursorPosition cursor) throws MessageDecodingException {
        if (cursor == null) {
            throw new MessageDecodingException("Null cursor");
        }
        requireId(cursor.getParticipantId(), "Cursor participant");
    }

    private static void validateMeasurements(List<SharedMeasurement> measurements) throws MessageDecodingException {
        Set<String> seen = new HashSet<>();
        for (SharedMeasurement measurement : measurements) {
            validateMeasurement(measurement);
            if (!seen.add(measurement.getId())) {
                throw new MessageDecodingException("Duplicate measurement " + measurement.getId());
            }
        }
    }

    private static void validateAnnotations(List<Annotation> annotations) throws MessageDecodingException {
        for (Annotation annotation : annotations) {
            validateAnnotation(annotation);
        }
    }

    private static void validateSession(Session raw) throws MessageDecodingException {
        requireId(raw.getId(), "Session");
        requireId(raw.getRoomCode(), "Session room code");

        // copy() turns absent collections into empty ones
        Session session = raw.copy();
        SessionSettings settings = session.getSettings();
        if (settings.getMaxParticipants() < 1 || settings.getExpiresIn() < 1) {
            throw new MessageDecodingException("Session " + raw.getId() + " has invalid settings");
        }

        Set<String> ids = new HashSet<>();
        int hosts = 0;
        for (Participant participant : session.getParticipants()) {
            validateParticipant(participant);
            if (!ids.add(participant.getId())) {
                throw new MessageDecodingException("Duplicate participant " + participant.getId());
            }
            if (participant.getRole() == Role.HOST) {
                hosts++;
            }
        }
        if (hosts > 1) {
            throw new MessageDecodingException("Session " + raw.getId() + " lists " + hosts + " hosts");
        }
        validateMeasurements(session.getMeasurements());
        validateAnnotations(session.getAnnotations());
        for (CursorPosition cursor : session.getCursors().values()) {
            validateCursor(cursor);
        }
    }

    private static void requireId(String id, String what) throws MessageDecodingException {
        if (id == null || id.isEmpty()) {
            throw new MessageDecodingException(what + " id is missing");
        }
    }
}
