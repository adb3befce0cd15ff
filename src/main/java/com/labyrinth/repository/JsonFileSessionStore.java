package com.labyrinth.repository;

import com.labyrinth.dto.SessionSnapshot;
import com.labyrinth.exception.SaveFailedException;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link SessionStore} backed by a single JSON file holding every player's save.
 * Each write rewrites the whole file, sorted by login; the last writer wins.
 */
@Repository
@Slf4j
public class JsonFileSessionStore implements SessionStore {

    private static final TypeReference<TreeMap<String, SessionSnapshot>> SAVES_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path saveFile;

    public JsonFileSessionStore(ObjectMapper objectMapper,
                                @Value("${labyrinth.save-file:game_save.json}") String saveFile) {
        this.objectMapper = objectMapper;
        this.saveFile = Paths.get(saveFile);
    }

    @Override
    public Optional<SessionSnapshot> loadSessionFor(String login) {
        return Optional.ofNullable(readAll().get(login));
    }

    @Override
    public boolean hasSessionFor(String login) {
        return readAll().containsKey(login);
    }

    @Override
    public void saveSessionFor(String login, SessionSnapshot snapshot) {
        Map<String, SessionSnapshot> saves = readAll();
        saves.put(login, snapshot);
        writeAll(saves);
        log.info("Saved game for '{}' to {}", login, saveFile);
    }

    @Override
    public void deleteSessionFor(String login) {
        Map<String, SessionSnapshot> saves = readAll();
        if (saves.remove(login) != null) {
            writeAll(saves);
            log.info("Deleted saved game for '{}'", login);
        }
    }

    /**
     * Read every save; a missing, empty or corrupt file counts as no saves at all.
     */
    Map<String, SessionSnapshot> readAll() {
        if (!Files.isRegularFile(saveFile)) {
            log.warn("Save file {} not found", saveFile);
            return new TreeMap<>();
        }
        try (InputStream is = Files.newInputStream(saveFile)) {
            TreeMap<String, SessionSnapshot> saves = objectMapper.readValue(is, SAVES_TYPE);
            return saves != null ? saves : new TreeMap<>();
        } catch (IOException | JacksonException e) {
            log.warn("Save file {} is empty or contains invalid data: {}", saveFile, e.getMessage());
            return new TreeMap<>();
        }
    }

    private void writeAll(Map<String, SessionSnapshot> saves) {
        try {
            Path parent = saveFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream os = Files.newOutputStream(saveFile)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(os, saves);
            }
        } catch (IOException | JacksonException e) {
            log.error("Could not write save file {}", saveFile, e);
            throw new SaveFailedException("Could not write save file " + saveFile, e);
        }
    }
}
