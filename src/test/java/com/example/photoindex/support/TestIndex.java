package com.example.photoindex.support;

import com.example.photoindex.IndexContext;
import com.example.photoindex.config.IndexerConfig;
import com.example.photoindex.failure.FailureTracker;
import com.example.photoindex.metadata.JsonMetadataStore;
import com.example.photoindex.store.FileEmbeddingStore;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.function.UnaryOperator;

/**
 * Wires an {@link IndexContext} over in-memory fakes and file stores under a temporary directory.
 */
public final class TestIndex {

    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    public final InMemoryAssetSource source = new InMemoryAssetSource();
    public final VectorTableExtractor extractor = new VectorTableExtractor();
    public final IndexContext context;

    public TestIndex(Path dir) {
        this(dir, b -> b);
    }

    public TestIndex(Path dir, UnaryOperator<IndexerConfig.Builder> customizer) {
        IndexerConfig config = customizer.apply(IndexerConfig.builder()
                .libraryDirectory(dir.resolve("library"))
                .storeDirectory(dir.resolve("embeddings"))
                .metadataFile(dir.resolve("metadata.json")))
                .build();
        this.context = new IndexContext(config, source, extractor,
                new FileEmbeddingStore(config.getStoreDirectory()),
                new FailureTracker(config.getMaxRetries()),
                new JsonMetadataStore(config.getMetadataFile()),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /** Minutes before {@link #NOW}. */
    public static Instant minutesAgo(long minutes) {
        return NOW.minusSeconds(minutes * 60);
    }

    /** Adds a photo and registers its vector. */
    public void photo(String id, Instant created, float[] vector) {
        source.add(id, created);
        extractor.put(id, vector);
    }
}
