package com.mythos.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes manager snapshots as JSON files.
 * <p>
 * I/O and parse failures are logged and reported as {@code false} / empty; callers keep their
 * in-memory state.
 */
public class ObjectiveStore {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveStore.class);

    private final ObjectMapper objectMapper;

    public ObjectiveStore() {
        this(JsonMapper.create());
    }

    public ObjectiveStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public boolean save(Path path, ManagerSnapshot snapshot) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), snapshot);
            log.info("Saved {} objectives to {}", snapshot.objectives().size(), path);
            return true;
        } catch (IOException e) {
            log.error("Failed to save objectives to {}: {}", path, e.getMessage(), e);
            return false;
        }
    }

    public Optional<ManagerSnapshot> load(Path path) {
        if (!Files.isRegularFile(path)) {
            log.warn("Objective save file {} does not exist", path);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), ManagerSnapshot.class));
        } catch (IOException e) {
            log.error("Failed to load objectives from {}: {}", path, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
