package com.roomsnap.collab.network;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.roomsnap.collab.session.Session;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Date;
import java.util.Optional;

/**
 * Stores rooms in MongoDB, one document per session.
 * <p>
 * Documents carry the room code and expiry next to the session JSON, so that
 * expired rooms can be removed on lookup.
 */
public class MongoRoomRepository implements RoomRepository {
    private static final Logger LOGGER = LoggerFactory.getLogger(MongoRoomRepository.class);
    
    private static final String ROOMS_COLLECTION = "rooms";
    
    private final MongoClient mongoClient;
    private final MongoCollection<Document> rooms;
    private final Clock clock;
    private final Gson gson = new Gson();
    
    MongoRoomRepository(MongoClient mongoClient, String databaseName, Clock clock) {
        this.mongoClient = mongoClient;
        this.clock = clock;
        MongoDatabase database = mongoClient.getDatabase(databaseName);
        this.rooms = database.getCollection(ROOMS_COLLECTION);
    }
    
    /**
     * Connects to MongoDB and checks the server answers.
     * @param connectionString The MongoDB connection string.
     * @param databaseName The database holding the rooms collection.
     * @param clock The clock used for expiry checks.
     * @return The connected repository.
     * @throws IllegalStateException if the server cannot be reached.
     */
    public static MongoRoomRepository connect(String connectionString, String databaseName, Clock clock) {
        MongoClient client = MongoClients.create(connectionString);
        try {
            client.getDatabase(databaseName).runCommand(new Document("ping", 1));
            MongoRoomRepository repository = new MongoRoomRepository(client, databaseName, clock);
            repository.rooms.createIndex(Indexes.ascending("roomCode"));
            LOGGER.info("Connected to MongoDB database {}", databaseName);
            return repository;
        } catch (RuntimeException e) {
            client.close();
            throw new IllegalStateException("Could not connect to MongoDB: " + e.getMessage(), e);
        }
    }
    
    @Override
    public void save(Session session) {
        long expiresAt = session.getCreatedAt() + session.getSettings().getExpiresIn() * 60_000L;
        Document document = new Document("_id", session.getId())
                .append("roomCode", session.getRoomCode())
                .append("expiresAt", new Date(expiresAt))
                .append("session", Document.parse(gson.toJson(session)));
        rooms.replaceOne(Filters.eq("_id", session.getId()), document, new ReplaceOptions().upsert(true));
    }
    
    @Override
    public Optional<Session> findByRoomCode(String roomCode) {
        return live(rooms.find(Filters.eq("roomCode", roomCode)).first());
    }
    
    @Override
    public Optional<Session> findById(String sessionId) {
        return live(rooms.find(Filters.eq("_id", sessionId)).first());
    }
    
    @Override
    public void delete(String sessionId) {
        rooms.deleteOne(Filters.eq("_id", sessionId));
    }
    
    @Override
    public void close() {
        mongoClient.close();
    }
    
    private Optional<Session> live(Document document) {
        if (document == null) {
            return Optional.empty();
        }
        Document body = document.get("session", Document.class);
        if (body == null) {
            LOGGER.warn("Room document {} has no session body", document.get("_id"));
            return Optional.empty();
        }
        
        Session session;
        try {
            session = gson.fromJson(body.toJson(), Session.class).copy();
        } catch (JsonSyntaxException e) {
            LOGGER.warn("Room document {} is unreadable: {}", document.get("_id"), e.getMessage());
            return Optional.empty();
        }
        
        if (session.isExpired(clock.millis())) {
            LOGGER.info("Removing expired room {}", session.getRoomCode());
            delete(session.getId());
            return Optional.empty();
        }
        return Optional.of(session);
    }
}
