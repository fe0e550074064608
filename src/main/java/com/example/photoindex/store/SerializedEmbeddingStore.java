package com.example.photoindex.store;

import com.example.photoindex.PhotoIndexException;
import com.example.photoindex.model.Embedding;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Predicate;

/**
 * Runs every operation of the wrapped store on one dedicated thread, in submission order.
 *
 * <p>Interactive queries and the background scanner can share one instance without knowing which
 * thread owns the underlying store. Operations are short (map lookups and single-record writes);
 * feature extraction always happens on the caller's thread, outside this queue.</p>
 */
public class SerializedEmbeddingStore implements EmbeddingStore, AutoCloseable {

    private final EmbeddingStore delegate;
    private final ExecutorService queue;

    public SerializedEmbeddingStore(EmbeddingStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate store cannot be null");
        }
        this.delegate = delegate;
        this.queue = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "embedding-store");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public Optional<Embedding> get(String id) {
        return call(() -> delegate.get(id));
    }

    @Override
    public Embedding put(String id, float[] vector, String contentHash, Instant computedAt, Instant sourceModifiedAt) {
        float[] copy = vector == null ? null : vector.clone();
        return call(() -> delegate.put(id, copy, contentHash, computedAt, sourceModifiedAt));
    }

    @Override
    public boolean delete(String id) {
        return call(() -> delegate.delete(id));
    }

    @Override
    public int count(Predicate<Embedding> predicate) {
        return call(() -> delegate.count(predicate));
    }

    @Override
    public List<Embedding> all() {
        return call(delegate::all);
    }

    @Override
    public Set<String> ids() {
        return call(delegate::ids);
    }

    @Override
    public int size() {
        return call(delegate::size);
    }

    private <T> T call(Callable<T> operation) {
        try {
            return queue.submit(operation).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PhotoIndexException("Interrupted while waiting for the embedding store", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new PhotoIndexException("Embedding store operation failed", cause);
        }
    }

    @Override
    public void close() {
        queue.shutdown();
    }
}
