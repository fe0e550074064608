package com.example.photoindex;

import ai.onnxruntime.OrtException;
import com.example.photoindex.config.IndexerConfig;
import com.example.photoindex.extract.ColorHistogramExtractor;
import com.example.photoindex.extract.FeatureExtractor;
import com.example.photoindex.extract.OnnxFeatureExtractor;
import com.example.photoindex.failure.FailureTracker;
import com.example.photoindex.metadata.JsonMetadataStore;
import com.example.photoindex.metadata.MetadataStore;
import com.example.photoindex.source.AssetSource;
import com.example.photoindex.source.DirectoryAssetSource;
import com.example.photoindex.store.EmbeddingStore;
import com.example.photoindex.store.FileEmbeddingStore;
import com.example.photoindex.store.SerializedEmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Everything one photo index works with, passed explicitly to each component.
 */
public final class IndexContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IndexContext.class);

    private final IndexerConfig config;
    private final AssetSource assetSource;
    private final FeatureExtractor extractor;
    private final EmbeddingStore store;
    private final FailureTracker failureTracker;
    private final MetadataStore metadata;
    private final Clock clock;

    public IndexContext(IndexerConfig config, AssetSource assetSource, FeatureExtractor extractor,
                        EmbeddingStore store, FailureTracker failureTracker, MetadataStore metadata, Clock clock) {
        if (config == null || assetSource == null || extractor == null || store == null
                || failureTracker == null || metadata == null || clock == null) {
            throw new IllegalArgumentException("all index collaborators are required");
        }
        this.config = config;
        this.assetSource = assetSource;
        this.extractor = extractor;
        this.store = store;
        this.failureTracker = failureTracker;
        this.metadata = metadata;
        this.clock = clock;
    }

    /**
     * Wires the file-backed adapters described by {@code config}. Uses the ONNX extractor when a model
     * path is configured and the colour histogram extractor otherwise.
     */
    public static IndexContext open(IndexerConfig config) throws OrtException {
        FeatureExtractor extractor = config.getModelPath() != null
                ? new OnnxFeatureExtractor(config.getModelPath(), config.getModelInputSize())
                : new ColorHistogramExtractor();
        log.info("Opening photo index: {} extractor={}", config, extractor.version());
        return open(config, extractor);
    }

    /**
     * Wires the file-backed adapters around {@code extractor}. If any of them cannot be opened, the
     * extractor and whatever was already opened are closed before the failure is rethrown.
     */
    static IndexContext open(IndexerConfig config, FeatureExtractor extractor) {
        SerializedEmbeddingStore store = null;
        try {
            AssetSource assetSource = new DirectoryAssetSource(config.getLibraryDirectory());
            store = new SerializedEmbeddingStore(new FileEmbeddingStore(config.getStoreDirectory()));
            MetadataStore metadata = new JsonMetadataStore(config.getMetadataFile());
            return new IndexContext(config, assetSource, extractor, store,
                    new FailureTracker(config.getMaxRetries()), metadata, Clock.systemUTC());
        } catch (RuntimeException e) {
            log.error("Failed to open photo index: {}", e.getMessage());
            if (store != null) {
                store.close();
            }
            try {
                extractor.close();
            } catch (Exception closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    public IndexerConfig getConfig() {
        return config;
    }

    public AssetSource getAssetSource() {
        return assetSource;
    }

    public FeatureExtractor getExtractor() {
        return extractor;
    }

    public EmbeddingStore getStore() {
        return store;
    }

    public FailureTracker getFailureTracker() {
        return failureTracker;
    }

    public MetadataStore getMetadata() {
        return metadata;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public void close() throws Exception {
        try {
            extractor.close();
        } finally {
            if (store instanceof AutoCloseable) {
                ((AutoCloseable) store).close();
            }
        }
    }
}
