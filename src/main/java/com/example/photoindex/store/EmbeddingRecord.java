package com.example.photoindex.store;

import com.example.photoindex.extract.FeatureEncoding;
import com.example.photoindex.model.Embedding;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * On-disk form of an {@link Embedding}. The vector is raw little-endian float32, which Jackson writes as base64.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddingRecord {
    public String id;
    public byte[] vector;
    public String contentHash;
    public String computedAt;
    public String sourceModifiedAt;

    public static EmbeddingRecord from(Embedding embedding) {
        EmbeddingRecord record = new EmbeddingRecord();
        record.id = embedding.getPhotoId();
        record.vector = FeatureEncoding.floatsToBytes(embedding.getVector());
        record.contentHash = embedding.getContentHash();
        record.computedAt = embedding.getComputedAt().toString();
        record.sourceModifiedAt = embedding.getSourceModifiedAt().toString();
        return record;
    }

    public Embedding toEmbedding() {
        return new Embedding(id, FeatureEncoding.bytesToFloats(vector), contentHash,
                Instant.parse(computedAt), Instant.parse(sourceModifiedAt));
    }
}
