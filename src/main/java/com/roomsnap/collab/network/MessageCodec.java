package com.roomsnap.collab.network;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.roomsnap.collab.error.MessageDecodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Converts envelopes and their payloads to and from JSON.
 */
public class MessageCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(MessageCodec.class);
    
    private final Gson gson = new Gson();
    
    /**
     * Encodes an envelope as JSON text.
     * @param message The envelope.
     * @return The JSON text.
     */
    public String encode(CollaborationMessage message) {
        JsonObject json = new JsonObject();
        json.addProperty("type", message.getType().wireName());
        json.addProperty("sessionId", message.getSessionId());
        json.addProperty("participantId", message.getParticipantId());
        json.add("data", message.getData());
        json.addProperty("timestamp", message.getTimestamp());
        json.addProperty("sequence", message.getSequence());
        return gson.toJson(json);
    }
    
    public byte[] encodeBytes(CollaborationMessage message) {
        return encode(message).getBytes(StandardCharsets.UTF_8);
    }
    
    /**
     * Decodes JSON text into an envelope.
     * @param text The JSON text.
     * @return The envelope, or empty if its type is unknown.
     * @throws MessageDecodingException if the text is not a well-formed envelope.
     */
    public Optional<CollaborationMessage> decode(String text) throws MessageDecodingException {
        JsonObject json;
        try {
            JsonElement parsed = JsonParser.parseString(text);
            if (!parsed.isJsonObject()) {
                throw new MessageDecodingException("Envelope is not a JSON object");
            }
            json = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new MessageDecodingException("Malformed envelope: " + e.getMessage(), e);
        }
        
        String typeName = requireString(json, "type");
        MessageType type = MessageType.fromWireName(typeName);
        if (type == null) {
            LOGGER.warn("Dropping envelope with unknown type '{}'", typeName);
            return Optional.empty();
        }
        
        return Optional.of(new CollaborationMessage(
                type,
                requireString(json, "sessionId"),
                requireString(json, "participantId"),
                json.get("data"),
                requireLong(json, "timestamp"),
                requireLong(json, "sequence")));
    }
    
    public Optional<CollaborationMessage> decodeBytes(byte[] bytes) throws MessageDecodingException {
        return decode(new String(bytes, StandardCharsets.UTF_8));
    }
    
    /**
     * Converts a payload object into its JSON tree.
     * @param payload The payload.
     * @return The JSON tree.
     */
    public JsonElement toPayload(Object payload) {
        return gson.toJsonTree(payload);
    }
    
    /**
     * Reads a typed payload out of an envelope's data.
     * @param data The envelope data.
     * @param type The payload class.
     * @param <T> The payload type.
     * @return The payload.
     * @throws MessageDecodingException if the data does not fit the payload class
     *         or lacks a field the payload needs.
     */
    public <T> T fromPayload(JsonElement data, Class<T> type) throws MessageDecodingException {
        if (data == null || data.isJsonNull()) {
            throw new MessageDecodingException("Missing " + type.getSimpleName() + " payload");
        }
        T payload;
        try {
            payload = gson.fromJson(data, type);
        } catch (JsonParseException e) {
            throw new MessageDecodingException(
                    "Invalid " + type.getSimpleName() + " payload: " + e.getMessage(), e);
        }
        if (payload == null) {
            throw new MessageDecodingException("Empty " + type.getSimpleName() + " payload");
        }
        PayloadValidator.validate(payload);
        return payload;
    }
    
    private static String requireString(JsonObject json, String field) throws MessageDecodingException {
        JsonElement element = json.get(field);
        if (element == null || !element.isJsonPrimitive()) {
            throw new MessageDecodingException("Envelope field '" + field + "' is missing");
        }
        return element.getAsString();
    }
    
    private static long requireLong(JsonObject json, String field) throws MessageDecodingException {
        JsonElement element = json.get(field);
        if (element == null || !element.isJsonPrimitive()) {
            throw new MessageDecodingException("Envelope field '" + field + "' is missing");
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (!primitive.isNumber()) {
            throw new MessageDecodingException("Envelope field '" + field + "' is not a number");
        }
        try {
            return primitive.getAsLong();
        } catch (NumberFormatException e) {
            throw new MessageDecodingException("Envelope field '" + field + "' is not an integer", e);
        }
    }
}
