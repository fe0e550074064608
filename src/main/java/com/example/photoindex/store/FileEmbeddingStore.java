package com.example.photoindex.store;

import com.example.photoindex.PhotoIndexException;
import com.example.photoindex.extract.ContentHash;
import com.example.photoindex.model.Embedding;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Embedding store backed by one JSON record file per photo.
 *
 * <p>All records are loaded into memory on open. Writes go to a temporary file that is atomically moved
 * over the record, so a crash leaves either the old or the new record, never a torn one. Writers of the
 * same id are serialised on a lock stripe; readers never block.</p>
 */
public class FileEmbeddingStore implements EmbeddingStore {

    private static final Logger log = LoggerFactory.getLogger(FileEmbeddingStore.class);

    private static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final int STRIPES = 32;

    private final Path directory;
    private final ObjectMapper mapper;
    private final ConcurrentHashMap<String, Embedding> index = new ConcurrentHashMap<>();
    private final Object[] stripes = new Object[STRIPES];

    public FileEmbeddingStore(Path directory) {
        this(directory, new ObjectMapper());
    }

    public FileEmbeddingStore(Path directory, ObjectMapper mapper) {
        if (directory == null) {
            throw new IllegalArgumentException("store directory cannot be null");
        }
        this.directory = directory;
        this.mapper = mapper;
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new Object();
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PhotoIndexException("Cannot create embedding store at " + directory, e);
        }
        load();
    }

    private void load() {
        int loaded = 0;
        int skipped = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    // Left behind by an interrupted write; the record itself is intact.
                    Files.deleteIfExists(file);
                    continue;
                }
                if (!name.endsWith(RECORD_SUFFIX)) {
                    continue;
                }
                try {
                    Embedding embedding = mapper.readValue(file.toFile(), EmbeddingRecord.class).toEmbedding();
                    index.put(embedding.getPhotoId(), embedding);
                    loaded++;
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping unreadable embedding record {}: {}", file, e.getMessage());
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new PhotoIndexException("Cannot read embedding store at " + directory, e);
        }
        log.info("Loaded {} embeddings from {} ({} unreadable)", loaded, directory, skipped);
    }

    @Override
    public Optional<Embedding> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(index.get(id));
    }

    @Override
    public Embedding put(String id, float[] vector, String contentHash, Instant computedAt, Instant sourceModifiedAt) {
        Embedding embedding = new Embedding(id, vector, contentHash, computedAt, sourceModifiedAt);
        Path target = recordFile(id);
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);

        synchronized (stripeFor(id)) {
            try {
                mapper.writeValue(temp.toFile(), EmbeddingRecord.from(embedding));
                try {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                throw new PersistFailureException("Failed to persist embedding for " + id, e);
            }
            index.put(id, embedding);
        }
        return embedding;
    }

    @Override
    public boolean delete(String id) {
        if (id == null) {
            return false;
        }
        synchronized (stripeFor(id)) {
            try {
                Files.deleteIfExists(recordFile(id));
            } catch (IOException e) {
                throw new PersistFailureException("Failed to delete embedding for " + id, e);
            }
            return index.remove(id) != null;
        }
    }

    @Override
    public int count(Predicate<Embedding> predicate) {
        int count = 0;
        for (Embedding embedding : index.values()) {
            if (predicate.test(embedding)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public List<Embedding> all() {
        return new ArrayList<>(index.values());
    }

    @Override
    public Set<String> ids() {
        return new HashSet<>(index.keySet());
    }

    @Override
    public int size() {
        return index.size();
    }

    Path recordFile(String id) {
        // Photo ids may contain path separators, so files are named by a digest of the id.
        return directory.resolve(ContentHash.of(id) + RECORD_SUFFIX);
    }

    private Object stripeFor(String id) {
        return stripes[Math.floorMod(id.hashCode(), STRIPES)];
    }
}
