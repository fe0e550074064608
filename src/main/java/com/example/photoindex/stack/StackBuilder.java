package com.example.photoindex.stack;

import com.example.photoindex.IndexContext;
import com.example.photoindex.config.IndexerConfig;
import com.example.photoindex.metadata.MetadataStore;
import com.example.photoindex.model.Embedding;
import com.example.photoindex.model.PhotoRef;
import com.example.photoindex.model.PhotoStack;
import com.example.photoindex.store.EmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Groups consecutive, visually near-identical photos into stacks.
 *
 * <p>The pass is sequential and greedy: each photo not yet in a stack becomes an anchor and pulls in the
 * following photos, up to the lookahead, for as long as each one is similar enough to the anchor. The
 * first photo that is not (or has no embedding) ends the stack. There is no backtracking and no reordering,
 * so concatenating the returned stacks gives back the input sequence.</p>
 *
 * <p>A builder is one stacking session: stack assignments are cleared in bulk on the first build only.</p>
 */
public class StackBuilder {

    private static final Logger log = LoggerFactory.getLogger(StackBuilder.class);

    private final IndexContext context;
    private final StackIdAllocator allocator;
    private final Runnable scanRequest;
    private final AtomicBoolean stacksCleared = new AtomicBoolean();
    private final AtomicBoolean scanRequested = new AtomicBoolean();

    /**
     * @param scanRequest invoked once per session when there are no embeddings at all
     */
    public StackBuilder(IndexContext context, StackIdAllocator allocator, Runnable scanRequest) {
        if (context == null || allocator == null) {
            throw new IllegalArgumentException("context and allocator are required");
        }
        this.context = context;
        this.allocator = allocator;
        this.scanRequest = scanRequest != null ? scanRequest : () -> { };
    }

    /**
     * @param photos photos sorted by creation time
     */
    public List<PhotoStack> buildStacks(List<PhotoRef> photos) {
        if (photos == null || photos.isEmpty()) {
            return Collections.emptyList();
        }
        MetadataStore metadata = context.getMetadata();
        EmbeddingStore store = context.getStore();
        IndexerConfig config = context.getConfig();

        if (stacksCleared.compareAndSet(false, true)) {
            metadata.clearAllStackIds();
        }

        if (store.size() == 0) {
            if (scanRequested.compareAndSet(false, true)) {
                log.info("No similarity indices available, using individual photos");
                scanRequest.run();
            }
            return singletons(photos);
        }

        int cap = Math.min(config.getStackProcessingCap(), photos.size());
        int lookahead = config.getStackLookahead();
        double threshold = config.getStackThreshold();
        int yieldEvery = config.getYieldEvery();

        List<PhotoStack> stacks = new ArrayList<>();
        boolean[] assigned = new boolean[cap];
        int created = 0;

        for (int i = 0; i < cap; i++) {
            if (assigned[i]) {
                continue;
            }
            PhotoRef anchor = photos.get(i);
            List<PhotoRef> current = new ArrayList<>();
            current.add(anchor);
            assigned[i] = true;

            Optional<Embedding> anchorEmbedding = store.get(anchor.getId());
            int end = Math.min(i + lookahead + 1, cap);
            for (int j = i + 1; j < end; j++) {
                if (assigned[j]) {
                    break;
                }
                PhotoRef candidate = photos.get(j);
                double similarity = similarity(anchorEmbedding, store.get(candidate.getId()));
                if (similarity > threshold) {
                    log.debug("Found similar photos: {} <-> {} (similarity: {}%)",
                            anchor.getId(), candidate.getId(), (int) (similarity * 100));
                    current.add(candidate);
                    assigned[j] = true;
                } else {
                    break;
                }
            }

            if (current.size() > 1) {
                long stackId = allocator.next();
                for (PhotoRef member : current) {
                    metadata.setStackId(member.getId(), stackId);
                }
                log.debug("Created stack with ID {} containing {} similar photos", stackId, current.size());
                stacks.add(PhotoStack.of(current, stackId));
                created++;
            } else {
                stacks.add(PhotoStack.single(anchor));
            }

            if (i % yieldEvery == 0) {
                Thread.yield();
            }
        }

        if (photos.size() > cap) {
            stacks.addAll(singletons(photos.subList(cap, photos.size())));
            log.info("Added {} remaining photos as individual photos (processing limit reached)",
                    photos.size() - cap);
        }

        log.info("Stored stack IDs for {} similarity-based stacks", created);
        return stacks;
    }

    /** Clears the session so the next build wipes stack assignments again. */
    public void newSession() {
        stacksCleared.set(false);
        scanRequested.set(false);
    }

    private static double similarity(Optional<Embedding> anchor, Optional<Embedding> candidate) {
        if (anchor.isEmpty() || candidate.isEmpty()) {
            return Double.NEGATIVE_INFINITY;
        }
        return anchor.get().cosineSimilarity(candidate.get());
    }

    private static List<PhotoStack> singletons(List<PhotoRef> photos) {
        List<PhotoStack> stacks = new ArrayList<>(photos.size());
        for (PhotoRef photo : photos) {
            stacks.add(PhotoStack.single(photo));
        }
        return stacks;
    }
}
