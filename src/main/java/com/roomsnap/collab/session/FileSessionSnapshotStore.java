package com.roomsnap.collab.session;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stores each session as a JSON file named after its id.
 * Persistence failures are logged; they never fail the calling operation.
 */
public class FileSessionSnapshotStore implements SessionSnapshotStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileSessionSnapshotStore.class);
    
    private static final String SUFFIX = ".json";
    
    private final Path directory;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    
    public FileSessionSnapshotStore(Path directory) {
        this.directory = directory;
    }
    
    @Override
    public synchronized void save(Session session) {
        Path target = fileFor(session.getId());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "snapshot", ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(session, writer);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | JsonIOException e) {
            LOGGER.warn("Could not save snapshot of session {}: {}", session.getId(), e.getMessage());
            deleteQuietly(temp);
        }
    }
    
    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOGGER.warn("Could not delete temporary snapshot {}: {}", temp, e.getMessage());
        }
    }
    
    @Override
    public synchronized Optional<Session> load(String sessionId) {
        Path file = fileFor(sessionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return read(file);
    }
    
    @Override
    public synchronized List<Session> loadAll() {
        List<Session> sessions = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return sessions;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                read(file).ifPresent(sessions::add);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not list snapshots in {}: {}", directory, e.getMessage());
        }
        return sessions;
    }
    
    @Override
    public synchronized void remove(String sessionId) {
        try {
            Files.deleteIfExists(fileFor(sessionId));
        } catch (IOException e) {
            LOGGER.warn("Could not delete snapshot of session {}: {}", sessionId, e.getMessage());
        }
    }
    
    private Optional<Session> read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Session session = gson.fromJson(reader, Session.class);
            if (session == null || session.getId() == null) {
                LOGGER.warn("Ignoring empty snapshot {}", file);
                return Optional.empty();
            }
            return Optional.of(session.copy());
        } catch (IOException | JsonParseException e) {
            LOGGER.warn("Ignoring unreadable snapshot {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
    
    private Path fileFor(String sessionId) {
        return directory.resolve(sessionId.replaceAll("[^A-Za-z0-9_-]", "_") + SUFFIX);
    }
}
