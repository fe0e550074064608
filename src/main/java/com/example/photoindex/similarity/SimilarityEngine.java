package com.example.photoindex.similarity;

import com.example.photoindex.IndexContext;
import com.example.photoindex.compute.ComputeResult;
import com.example.photoindex.compute.EmbeddingResolver;
import com.example.photoindex.model.Embedding;
import com.example.photoindex.model.PhotoRef;
import com.example.photoindex.model.SimilarPhoto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Brute-force cosine ranking over every stored embedding. Linear in the store size per query,
 * which is fine for libraries in the low thousands.
 */
public class SimilarityEngine {

    private static final Logger log = LoggerFactory.getLogger(SimilarityEngine.class);

    static final Comparator<SimilarPhoto> RANKING = Comparator
            .comparingDouble(SimilarPhoto::getSimilarity).reversed()
            .thenComparing(SimilarPhoto::getPhotoId);

    private final IndexContext context;
    private final EmbeddingResolver resolver;

    public SimilarityEngine(IndexContext context, EmbeddingResolver resolver) {
        if (context == null || resolver == null) {
            throw new IllegalArgumentException("context and resolver are required");
        }
        this.context = context;
        this.resolver = resolver;
    }

    /**
     * Photos whose similarity to {@code target} is at least {@code threshold}, best first, at most {@code limit}.
     * The target's own embedding is computed on demand. Returns an empty list when it cannot be obtained.
     */
    public List<SimilarPhoto> findSimilar(PhotoRef target, double threshold, int limit) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (limit <= 0) {
            return Collections.emptyList();
        }
        long start = System.nanoTime();

        long resolveStart = System.nanoTime();
        ComputeResult resolved = resolver.resolve(target);
        double resolveSeconds = (System.nanoTime() - resolveStart) / 1e9;
        if (!resolved.isSuccess()) {
            log.info("No embedding available for target {}: {}", target.getId(), resolved);
            return Collections.emptyList();
        }
        if (resolved.getStatus() == ComputeResult.Status.COMPUTED) {
            log.info("Single embedding computation time: {} seconds", String.format("%.3f", resolveSeconds));
        }

        List<SimilarPhoto> results = rank(resolved.getEmbedding(), context.getStore().all(), threshold, limit);

        log.info("findSimilar completed in {} seconds, {} photos above threshold {}",
                String.format("%.3f", (System.nanoTime() - start) / 1e9), results.size(), threshold);
        return results;
    }

    /**
     * Ranks {@code candidates} against {@code target}, excluding the target itself.
     */
    public static List<SimilarPhoto> rank(Embedding target, List<Embedding> candidates, double threshold, int limit) {
        List<SimilarPhoto> similarities = new ArrayList<>();
        for (Embedding candidate : candidates) {
            if (candidate.getPhotoId().equals(target.getPhotoId())) {
                continue;
            }
            double similarity = target.cosineSimilarity(candidate);
            if (similarity >= threshold) {
                similarities.add(new SimilarPhoto(candidate.getPhotoId(), similarity));
            }
        }

        similarities.sort(RANKING);
        return similarities.size() > limit ? new ArrayList<>(similarities.subList(0, limit)) : similarities;
    }

    /**
     * Similarity of two stored embeddings; empty when either photo has none.
     */
    public OptionalDouble similarity(String firstId, String secondId) {
        Optional<Embedding> first = context.getStore().get(firstId);
        Optional<Embedding> second = context.getStore().get(secondId);
        if (first.isEmpty() || second.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(first.get().cosineSimilarity(second.get()));
    }
}
