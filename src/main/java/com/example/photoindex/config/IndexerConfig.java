package com.example.photoindex.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings for one photo index.
 *
 * <p>Build one with {@link #builder()} or load it from properties:</p>
 * <pre>{@code
 * library.dir=/photos
 * store.dir=/var/lib/photo-index/embeddings
 * metadata.file=/var/lib/photo-index/metadata.json
 * model.path=/models/resnet50.onnx
 * }</pre>
 */
public final class IndexerConfig {

    public static final String CONFIG_PROPERTY = "photoindex.config";
    public static final String DEFAULT_RESOURCE = "photoindex.properties";

    private final Path libraryDirectory;
    private final Path storeDirectory;
    private final Path metadataFile;
    private final Path modelPath;
    private final int modelInputSize;
    private final int maxImageDimension;
    private final int maxRetries;
    private final double similarThreshold;
    private final int similarLimit;
    private final double duplicateThreshold;
    private final double stackThreshold;
    private final int stackLookahead;
    private final int stackProcessingCap;
    private final int yieldEvery;

    private IndexerConfig(Builder b) {
        this.libraryDirectory = b.libraryDirectory;
        this.storeDirectory = b.storeDirectory;
        this.metadataFile = b.metadataFile;
        this.modelPath = b.modelPath;
        this.modelInputSize = b.modelInputSize;
        this.maxImageDimension = b.maxImageDimension;
        this.maxRetries = b.maxRetries;
        this.similarThreshold = b.similarThreshold;
        this.similarLimit = b.similarLimit;
        this.duplicateThreshold = b.duplicateThreshold;
        this.stackThreshold = b.stackThreshold;
        this.stackLookahead = b.stackLookahead;
        this.stackProcessingCap = b.stackProcessingCap;
        this.yieldEvery = b.yieldEvery;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from properties; missing keys keep their defaults.
     */
    public static IndexerConfig fromProperties(Properties props) {
        Builder b = builder();
        String library = props.getProperty("library.dir");
        if (library != null) {
            b.libraryDirectory(Paths.get(library.trim()));
        }
        String store = props.getProperty("store.dir");
        if (store != null) {
            b.storeDirectory(Paths.get(store.trim()));
        }
        String metadata = props.getProperty("metadata.file");
        if (metadata != null) {
            b.metadataFile(Paths.get(metadata.trim()));
        }
        String model = props.getProperty("model.path");
        if (model != null && !model.trim().isEmpty()) {
            b.modelPath(Paths.get(model.trim()));
        }
        b.modelInputSize(intValue(props, "model.input-size", b.modelInputSize));
        b.maxImageDimension(intValue(props, "image.max-dimension", b.maxImageDimension));
        b.maxRetries(intValue(props, "failures.max-retries", b.maxRetries));
        b.similarThreshold(doubleValue(props, "similar.threshold", b.similarThreshold));
        b.similarLimit(intValue(props, "similar.limit", b.similarLimit));
        b.duplicateThreshold(doubleValue(props, "duplicates.threshold", b.duplicateThreshold));
        b.stackThreshold(doubleValue(props, "stack.threshold", b.stackThreshold));
        b.stackLookahead(intValue(props, "stack.lookahead", b.stackLookahead));
        b.stackProcessingCap(intValue(props, "stack.processing-cap", b.stackProcessingCap));
        b.yieldEvery(intValue(props, "scan.yield-every", b.yieldEvery));
        return b.build();
    }

    /**
     * Loads the file named by the {@code photoindex.config} system property, or else
     * {@code photoindex.properties} from the classpath. Defaults apply when neither exists.
     */
    public static IndexerConfig load() throws IOException {
        Properties props = new Properties();
        String location = System.getProperty(CONFIG_PROPERTY);
        if (location != null) {
            try (InputStream in = Files.newInputStream(Paths.get(location))) {
                props.load(in);
            }
        } else {
            try (InputStream in = IndexerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in != null) {
                    props.load(in);
                }
            }
        }
        return fromProperties(props);
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    public Path getLibraryDirectory() {
        return libraryDirectory;
    }

    public Path getStoreDirectory() {
        return storeDirectory;
    }

    public Path getMetadataFile() {
        return metadataFile;
    }

    /** Null when no model is configured; the colour histogram extractor is used instead. */
    public Path getModelPath() {
        return modelPath;
    }

    public int getModelInputSize() {
        return modelInputSize;
    }

    public int getMaxImageDimension() {
        return maxImageDimension;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public double getSimilarThreshold() {
        return similarThreshold;
    }

    public int getSimilarLimit() {
        return similarLimit;
    }

    public double getDuplicateThreshold() {
        return duplicateThreshold;
    }

    public double getStackThreshold() {
        return stackThreshold;
    }

    public int getStackLookahead() {
        return stackLookahead;
    }

    public int getStackProcessingCap() {
        return stackProcessingCap;
    }

    public int getYieldEvery() {
        return yieldEvery;
    }

    @Override
    public String toString() {
        return "IndexerConfig{library=" + libraryDirectory + ", store=" + storeDirectory
                + ", metadata=" + metadataFile + ", model=" + modelPath
                + ", maxImageDimension=" + maxImageDimension + ", maxRetries=" + maxRetries + "}";
    }

    public static final class Builder {
        private Path libraryDirectory = Paths.get("photos");
        private Path storeDirectory = Paths.get("photo-index", "embeddings");
        private Path metadataFile = Paths.get("photo-index", "metadata.json");
        private Path modelPath;
        private int modelInputSize = 224;
        private int maxImageDimension = 512;
        private int maxRetries = 3;
        private double similarThreshold = 0.7;
        private int similarLimit = 20;
        private double duplicateThreshold = 0.95;
        private double stackThreshold = 0.95;
        private int stackLookahead = 5;
        private int stackProcessingCap = 100;
        private int yieldEvery = 10;

        private Builder() {}

        public Builder libraryDirectory(Path libraryDirectory) {
            this.libraryDirectory = libraryDirectory;
            return this;
        }

        public Builder storeDirectory(Path storeDirectory) {
            this.storeDirectory = storeDirectory;
            return this;
        }

        public Builder metadataFile(Path metadataFile) {
            this.metadataFile = metadataFile;
            return this;
        }

        public Builder modelPath(Path modelPath) {
            this.modelPath = modelPath;
            return this;
        }

        /** Square input edge the ONNX model expects. */
        public Builder modelInputSize(int modelInputSize) {
            this.modelInputSize = modelInputSize;
            return this;
        }

        /** Images are downsampled so that neither side exceeds this before extraction. */
        public Builder maxImageDimension(int maxImageDimension) {
            this.maxImageDimension = maxImageDimension;
            return this;
        }

        /** Failed attempts after which a photo is skipped by batch scans. */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder similarThreshold(double similarThreshold) {
            this.similarThreshold = similarThreshold;
            return this;
        }

        public Builder similarLimit(int similarLimit) {
            this.similarLimit = similarLimit;
            return this;
        }

        public Builder duplicateThreshold(double duplicateThreshold) {
            this.duplicateThreshold = duplicateThreshold;
            return this;
        }

        /** Similarity a photo must exceed to join the current stack. */
        public Builder stackThreshold(double stackThreshold) {
            this.stackThreshold = stackThreshold;
            return this;
        }

        /** How many following photos an anchor is compared against. */
        public Builder stackLookahead(int stackLookahead) {
            this.stackLookahead = stackLookahead;
            return this;
        }

        /** Photos considered per stacking pass; the rest become singletons. */
        public Builder stackProcessingCap(int stackProcessingCap) {
            this.stackProcessingCap = stackProcessingCap;
            return this;
        }

        /** The scanner yields to other threads after this many photos. */
        public Builder yieldEvery(int yieldEvery) {
            this.yieldEvery = yieldEvery;
            return this;
        }

        public IndexerConfig build() {
            if (libraryDirectory == null || storeDirectory == null || metadataFile == null) {
                throw new IllegalArgumentException("library, store and metadata locations are required");
            }
            requirePositive(modelInputSize, "model.input-size");
            requirePositive(maxImageDimension, "image.max-dimension");
            requirePositive(maxRetries, "failures.max-retries");
            requirePositive(similarLimit, "similar.limit");
            requirePositive(stackLookahead, "stack.lookahead");
            requirePositive(stackProcessingCap, "stack.processing-cap");
            requirePositive(yieldEvery, "scan.yield-every");
            requireSimilarity(similarThreshold, "similar.threshold");
            requireSimilarity(duplicateThreshold, "duplicates.threshold");
            requireSimilarity(stackThreshold, "stack.threshold");
            return new IndexerConfig(this);
        }

        private static void requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }

        private static void requireSimilarity(double value, String name) {
            if (value < -1.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be within [-1, 1], got " + value);
            }
        }
    }
}
