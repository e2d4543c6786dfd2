package com.wordscout.discovery.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.wordscout.config.DiscoveryProperties;
import com.wordscout.discovery.model.DiscoveryCheckpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Checkpoint file on local disk. Writes go to a sibling temp file that is then moved over the
 * target, so a crash mid-write leaves the previous checkpoint intact.
 */
@Component
public class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final ObjectMapper objectMapper;
    private final Path path;

    @Autowired
    public CheckpointStore(ObjectMapper objectMapper, DiscoveryProperties properties) {
        this(objectMapper, Path.of(properties.getCheckpoint().getPath()));
    }

    public CheckpointStore(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.path = path.toAbsolutePath();
    }

    public Path path() {
        return path;
    }

    public void save(DiscoveryCheckpoint checkpoint) {
        Path parent = path.getParent();
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(temp.toFile(), checkpoint);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write checkpoint " + path, e);
        }
        log.debug(
            "Checkpoint saved to {} (pending={}, keywords={})",
            path,
            checkpoint.pendingTasks().size(),
            checkpoint.keywords().size()
        );
    }

    public Optional<DiscoveryCheckpoint> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), DiscoveryCheckpoint.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint " + path, e);
        }
    }

    public boolean clear() {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete checkpoint " + path, e);
        }
    }
}
