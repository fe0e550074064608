package com.example.photoindex.metadata;

import com.example.photoindex.PhotoIndexException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Metadata store kept in a single JSON file, rewritten atomically on every change.
 */
public class JsonMetadataStore implements MetadataStore {

    private static final Logger log = LoggerFactory.getLogger(JsonMetadataStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final State state;

    public JsonMetadataStore(Path file) {
        this(file, new ObjectMapper());
    }

    public JsonMetadataStore(Path file, ObjectMapper mapper) {
        if (file == null) {
            throw new IllegalArgumentException("metadata file cannot be null");
        }
        this.file = file;
        this.mapper = mapper;
        this.state = load();
    }

    private State load() {
        if (!Files.exists(file)) {
            return new State();
        }
        try {
            State loaded = mapper.readValue(file.toFile(), State.class);
            if (loaded.stackIds == null) {
                loaded.stackIds = new TreeMap<>();
            }
            return loaded;
        } catch (IOException e) {
            throw new PhotoIndexException("Cannot read metadata file " + file, e);
        }
    }

    @Override
    public synchronized OptionalLong getStackId(String photoId) {
        Long stackId = state.stackIds.get(photoId);
        return stackId != null && stackId > 0 ? OptionalLong.of(stackId) : OptionalLong.empty();
    }

    @Override
    public synchronized void setStackId(String photoId, long stackId) {
        if (photoId == null || photoId.isEmpty()) {
            throw new IllegalArgumentException("photoId cannot be null or empty");
        }
        if (stackId <= 0) {
            state.stackIds.remove(photoId);
        } else {
            state.stackIds.put(photoId, stackId);
            state.stackIdHighWater = Math.max(state.stackIdHighWater, stackId);
        }
        save();
    }

    @Override
    public synchronized int clearAllStackIds() {
        int cleared = 0;
        for (Iterator<Long> it = state.stackIds.values().iterator(); it.hasNext(); ) {
            if (it.next() > 0) {
                cleared++;
            }
            it.remove();
        }
        save();
        log.info("Cleared {} stack ids", cleared);
        return cleared;
    }

    @Override
    public synchronized long maxStackId() {
        return state.stackIdHighWater;
    }

    @Override
    public synchronized Optional<Instant> getWatermark() {
        return state.watermark == null ? Optional.empty() : Optional.of(Instant.parse(state.watermark));
    }

    @Override
    public synchronized void setWatermark(Instant watermark) {
        if (watermark == null) {
            throw new IllegalArgumentException("watermark cannot be null");
        }
        state.watermark = watermark.toString();
        save();
    }

    @Override
    public synchronized void clearWatermark() {
        state.watermark = null;
        save();
    }

    private void save() {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PhotoIndexException("Failed to write metadata file " + file, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class State {
        public Map<String, Long> stackIds = new TreeMap<>();
        public long stackIdHighWater;
        public String watermark;
    }
}
