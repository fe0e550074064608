package com.example.photoindex.store;

import com.example.photoindex.model.Embedding;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerializedEmbeddingStoreTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private SerializedEmbeddingStore store;

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    void concurrentWritersAllLand() throws Exception {
        store = new SerializedEmbeddingStore(new FileEmbeddingStore(dir));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        store.put("p-" + thread + "-" + i, new float[]{thread, i}, "h", T, T);
                        store.get("p-" + thread + "-" + i);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.size()).isEqualTo(200);
        assertThat(new FileEmbeddingStore(dir).size()).isEqualTo(200);
    }

    @Test
    void operationsRunOnTheStoreThread() {
        List<String> threads = new ArrayList<>();
        store = new SerializedEmbeddingStore(new RecordingStore(threads));

        store.get("a");
        store.size();

        assertThat(threads).containsOnly("embedding-store");
    }

    @Test
    void delegateExceptionsReachTheCaller() {
        store = new SerializedEmbeddingStore(new RecordingStore(new ArrayList<>()));
        assertThatThrownBy(() -> store.put("a", new float[]{1f}, "h", T, T))
                .isInstanceOf(PersistFailureException.class)
                .hasMessageContaining("disk full");
    }

    private static final class RecordingStore implements EmbeddingStore {
        private final List<String> threads;

        RecordingStore(List<String> threads) {
            this.threads = threads;
        }

        private void record() {
            threads.add(Thread.currentThread().getName());
        }

        @Override
        public Optional<Embedding> get(String id) {
            record();
            return Optional.empty();
        }

        @Override
        public Embedding put(String id, float[] vector, String contentHash, Instant computedAt,
                             Instant sourceModifiedAt) {
            throw new PersistFailureException("disk full", null);
        }

        @Override
        public boolean delete(String id) {
            return false;
        }

        @Override
        public int count(Predicate<Embedding> predicate) {
            record();
            return 0;
        }

        @Override
        public List<Embedding> all() {
            return new ArrayList<>();
        }

        @Override
        public Set<String> ids() {
            return Set.of();
        }
    }
}
