package com.example.photoindex.similarity;

import com.example.photoindex.model.DuplicateGroup;
import com.example.photoindex.model.Embedding;
import com.example.photoindex.model.SimilarPhoto;
import com.example.photoindex.store.EmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Single greedy pass that clusters near-identical embeddings. Quadratic in the store size.
 */
public class DuplicateGrouper {

    private static final Logger log = LoggerFactory.getLogger(DuplicateGrouper.class);

    public static final double DEFAULT_THRESHOLD = 0.95;

    private final EmbeddingStore store;

    public DuplicateGrouper(EmbeddingStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    public List<DuplicateGroup> findDuplicates() {
        return findDuplicates(DEFAULT_THRESHOLD);
    }

    /**
     * Each not-yet-grouped embedding, in id order, seeds a group of every other not-yet-grouped embedding
     * scoring at least {@code threshold} against it. Seeds without matches are not reported.
     */
    public List<DuplicateGroup> findDuplicates(double threshold) {
        List<Embedding> embeddings = store.all();
        embeddings.sort(Comparator.comparing(Embedding::getPhotoId));

        List<DuplicateGroup> groups = new ArrayList<>();
        Set<String> grouped = new HashSet<>();

        for (Embedding seed : embeddings) {
            if (grouped.contains(seed.getPhotoId())) {
                continue;
            }
            List<SimilarPhoto> matches = new ArrayList<>();

            for (Embedding other : embeddings) {
                if (other.getPhotoId().equals(seed.getPhotoId()) || grouped.contains(other.getPhotoId())) {
                    continue;
                }
                double similarity = seed.cosineSimilarity(other);
                if (similarity >= threshold) {
                    matches.add(new SimilarPhoto(other.getPhotoId(), similarity));
                }
            }

            grouped.add(seed.getPhotoId());
            if (!matches.isEmpty()) {
                for (SimilarPhoto match : matches) {
                    grouped.add(match.getPhotoId());
                }
                groups.add(new DuplicateGroup(seed.getPhotoId(), matches));
            }
        }

        log.info("Found {} duplicate groups among {} embeddings (threshold {})",
                groups.size(), embeddings.size(), threshold);
        return groups;
    }
}
