package com.example.photoindex.store;

import com.example.photoindex.model.Embedding;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Durable map from photo id to its embedding. Lookups by id are O(1).
 *
 * <p>An absent id is not an error: {@link #get} returns an empty optional.</p>
 */
public interface EmbeddingStore {

    Optional<Embedding> get(String id);

    /**
     * Inserts or overwrites the embedding for {@code id}.
     *
     * @throws PersistFailureException if the record could not be written durably
     */
    Embedding put(String id, float[] vector, String contentHash, Instant computedAt, Instant sourceModifiedAt);

    /**
     * @return true if an embedding was removed
     * @throws PersistFailureException if the record could not be removed from durable storage
     */
    boolean delete(String id);

    int count(Predicate<Embedding> predicate);

    /** Point-in-time copy of every stored embedding. */
    List<Embedding> all();

    Set<String> ids();

    default int size() {
        return count(e -> true);
    }
}
