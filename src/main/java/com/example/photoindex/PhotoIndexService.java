package com.example.photoindex;

import ai.onnxruntime.OrtException;
import com.example.photoindex.compute.ComputeResult;
import com.example.photoindex.compute.EmbeddingResolver;
import com.example.photoindex.config.IndexerConfig;
import com.example.photoindex.model.DuplicateGroup;
import com.example.photoindex.model.EmbeddingStats;
import com.example.photoindex.model.PhotoRef;
import com.example.photoindex.model.PhotoStack;
import com.example.photoindex.model.SimilarPhoto;
import com.example.photoindex.scan.IncrementalScanner;
import com.example.photoindex.scan.ProgressListener;
import com.example.photoindex.scan.ScanReport;
import com.example.photoindex.scan.ScanScheduler;
import com.example.photoindex.similarity.DuplicateGrouper;
import com.example.photoindex.similarity.SimilarityEngine;
import com.example.photoindex.source.SortKey;
import com.example.photoindex.stack.StackBuilder;
import com.example.photoindex.stack.StackIdAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Future;

/**
 * Entry point to a photo index: similarity queries, duplicate detection, stacking and background scanning
 * over one {@link IndexContext}.
 */
public class PhotoIndexService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PhotoIndexService.class);

    private final IndexContext context;
    private final boolean ownsContext;
    private final EmbeddingResolver resolver;
    private final SimilarityEngine similarityEngine;
    private final DuplicateGrouper duplicateGrouper;
    private final IncrementalScanner scanner;
    private final ScanScheduler scheduler;
    private final StackBuilder stackBuilder;

    public PhotoIndexService(IndexerConfig config) throws OrtException {
        this(IndexContext.open(config), true);
    }

    /**
     * Uses a context owned by the caller; {@link #close()} leaves it open.
     */
    public PhotoIndexService(IndexContext context) {
        this(context, false);
    }

    private PhotoIndexService(IndexContext context, boolean ownsContext) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
        this.ownsContext = ownsContext;
        this.resolver = new EmbeddingResolver(context);
        this.similarityEngine = new SimilarityEngine(context, resolver);
        this.duplicateGrouper = new DuplicateGrouper(context.getStore());
        this.scanner = new IncrementalScanner(context, resolver);
        this.scheduler = new ScanScheduler(scanner);
        this.stackBuilder = new StackBuilder(context, new StackIdAllocator(context.getMetadata()),
                () -> scheduler.requestScan(ProgressListener.NONE));
    }

    /**
     * Compute-or-fetch for one photo on the caller's thread. Empty when the library has no such photo.
     */
    public Optional<ComputeResult> computeNow(String photoId) {
        return context.getAssetSource().find(photoId).map(resolver::resolve);
    }

    public List<SimilarPhoto> findSimilar(String photoId) {
        IndexerConfig config = context.getConfig();
        return findSimilar(photoId, config.getSimilarThreshold(), config.getSimilarLimit());
    }

    public List<SimilarPhoto> findSimilar(String photoId, double threshold, int limit) {
        Optional<PhotoRef> target = context.getAssetSource().find(photoId);
        if (target.isEmpty()) {
            log.info("Photo not found: {}", photoId);
            return Collections.emptyList();
        }
        return similarityEngine.findSimilar(target.get(), threshold, limit);
    }

    public List<DuplicateGroup> findDuplicates() {
        return findDuplicates(context.getConfig().getDuplicateThreshold());
    }

    public List<DuplicateGroup> findDuplicates(double threshold) {
        return duplicateGrouper.findDuplicates(threshold);
    }

    /** Stacks the whole library, oldest first. */
    public List<PhotoStack> buildStacks() {
        return buildStacks(context.getAssetSource().enumerate(SortKey.CREATION_TIME_ASCENDING, null));
    }

    /**
     * @param photos photos sorted by creation time
     */
    public List<PhotoStack> buildStacks(List<PhotoRef> photos) {
        return stackBuilder.buildStacks(photos);
    }

    /** Starts a new stacking session: the next build clears all stack assignments first. */
    public void newStackingSession() {
        stackBuilder.newSession();
    }

    /** Runs a scan on the caller's thread. */
    public ScanReport runScan(ProgressListener progress) {
        return scanner.run(progress);
    }

    public Future<ScanReport> scanInBackground(ProgressListener progress) {
        return scheduler.requestScan(progress);
    }

    public boolean isScanning() {
        return scheduler.isRunning();
    }

    public void cancelScan() {
        scheduler.cancel();
    }

    public EmbeddingStats getStats() {
        Set<String> libraryIds = new HashSet<>();
        for (PhotoRef photo : context.getAssetSource().enumerate(SortKey.CREATION_TIME_ASCENDING, null)) {
            libraryIds.add(photo.getId());
        }
        int withEmbeddings = context.getStore().count(e -> libraryIds.contains(e.getPhotoId()));
        return new EmbeddingStats(libraryIds.size(), withEmbeddings,
                context.getFailureTracker().permanentFailureCount());
    }

    /**
     * Deletes stored embeddings whose photo is no longer in the library.
     *
     * @return number of embeddings deleted
     */
    public int cleanupOrphans() {
        int deleted = 0;
        for (String id : context.getStore().ids()) {
            if (!context.getAssetSource().exists(id) && context.getStore().delete(id)) {
                deleted++;
            }
        }
        log.info("Cleaned up {} orphaned embeddings", deleted);
        return deleted;
    }

    public void resetFailures() {
        context.getFailureTracker().clearAll();
    }

    public void resetWatermark() {
        scanner.resetWatermark();
    }

    public IndexContext getContext() {
        return context;
    }

    @Override
    public void close() throws Exception {
        try {
            scheduler.close();
        } finally {
            if (ownsContext) {
                context.close();
            }
        }
    }

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            printUsage();
            return;
        }
        IndexerConfig config = IndexerConfig.load();

        try (PhotoIndexService service = new PhotoIndexService(config)) {
            String command = args[0];
            switch (command) {
                case "scan": {
                    System.out.println("Scanning " + config.getLibraryDirectory() + "...");
                    ScanReport report = service.runScan((processed, total) -> {
                        if (total > 0 && (processed % 50 == 0 || processed == total)) {
                            System.out.println("  " + processed + "/" + total);
                        }
                    });
                    System.out.println("\n=== RESULT ===");
                    System.out.println(report);
                    break;
                }
                case "similar": {
                    if (args.length < 2) {
                        printUsage();
                        return;
                    }
                    double threshold = args.length > 2 ? Double.parseDouble(args[2]) : config.getSimilarThreshold();
                    int limit = args.length > 3 ? Integer.parseInt(args[3]) : config.getSimilarLimit();
                    List<SimilarPhoto> similar = service.findSimilar(args[1], threshold, limit);
                    System.out.println("\nPhotos similar to " + args[1] + ":");
                    for (SimilarPhoto photo : similar) {
                        System.out.println("  " + photo.getPhotoId() + ": "
                                + String.format("%.4f", photo.getSimilarity()));
                    }
                    if (similar.isEmpty()) {
                        System.out.println("  (none)");
                    }
                    break;
                }
                case "duplicates": {
                    double threshold = args.length > 1 ? Double.parseDouble(args[1]) : config.getDuplicateThreshold();
                    List<DuplicateGroup> groups = service.findDuplicates(threshold);
                    System.out.println("\nFound " + groups.size() + " duplicate groups:");
                    for (DuplicateGroup group : groups) {
                        System.out.println("  " + String.join(", ", group.getAllIds()));
                    }
                    break;
                }
                case "stacks": {
                    List<PhotoStack> stacks = service.buildStacks();
                    int stacked = 0;
                    for (PhotoStack stack : stacks) {
                        if (stack.isStack()) {
                            stacked++;
                            System.out.println("  Stack " + stack.getStackId().getAsLong() + ": " + stack.getCount()
                                    + " photos starting at " + stack.getPrimary().getId());
                        }
                    }
                    System.out.println("\n" + stacks.size() + " items, " + stacked + " stacks");
                    break;
                }
                case "stats":
                    System.out.println(service.getStats());
                    break;
                case "cleanup":
                    System.out.println("Deleted " + service.cleanupOrphans() + " orphaned embeddings");
                    break;
                case "reset-failures":
                    service.resetFailures();
                    System.out.println("Failure tracking cleared");
                    break;
                case "reset-watermark":
                    service.resetWatermark();
                    System.out.println("Watermark cleared - next scan processes the whole library");
                    break;
                default:
                    System.err.println("Unknown command: " + command);
                    printUsage();
            }
        }
    }

    private static void printUsage() {
        System.out.println("Usage: PhotoIndexService <command>");
        System.out.println("  scan                              index photos added since the last scan");
        System.out.println("  similar <id> [threshold] [limit]  photos visually similar to <id>");
        System.out.println("  duplicates [threshold]            groups of near-identical photos");
        System.out.println("  stacks                            group consecutive similar photos");
        System.out.println("  stats                             embedding coverage");
        System.out.println("  cleanup                           delete embeddings of removed photos");
        System.out.println("  reset-failures                    retry permanently failed photos");
        System.out.println("  reset-watermark                   rescan the whole library next time");
        System.out.println("Configuration: -D" + IndexerConfig.CONFIG_PROPERTY + "=<file>, or "
                + IndexerConfig.DEFAULT_RESOURCE + " on the classpath");
    }
}
