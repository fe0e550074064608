package com.example.photoindex;

import com.example.photoindex.compute.ComputeResult;
import com.example.photoindex.model.DuplicateGroup;
import com.example.photoindex.model.EmbeddingStats;
import com.example.photoindex.model.PhotoStack;
import com.example.photoindex.model.SimilarPhoto;
import com.example.photoindex.scan.ProgressListener;
import com.example.photoindex.scan.ScanReport;
import com.example.photoindex.support.TestIndex;
import com.example.photoindex.support.TestVectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PhotoIndexServiceTest {

    private static final Instant BURST = Instant.parse("2024-05-20T18:30:00Z");

    @TempDir
    Path dir;

    private TestIndex index;
    private PhotoIndexService service;

    @BeforeEach
    void setUp() {
        index = new TestIndex(dir);
        // A burst of three near-identical shots, then two unrelated photos.
        index.photo("burst-1", BURST, TestVectors.pairwise(0.98, 1));
        index.photo("burst-2", BURST.plusSeconds(1), TestVectors.pairwise(0.98, 2));
        index.photo("burst-3", BURST.plusSeconds(2), TestVectors.pairwise(0.98, 3));
        index.photo("beach", BURST.plusSeconds(600), TestVectors.basis(8));
        index.photo("dog", BURST.plusSeconds(1200), TestVectors.basis(9));
        service = new PhotoIndexService(index.context);
    }

    @AfterEach
    void tearDown() throws Exception {
        service.close();
    }

    @Test
    @DisplayName("scan, then query similar photos, duplicates and stacks")
    void endToEnd() {
        ScanReport report = service.runScan(ProgressListener.NONE);
        assertThat(report.getComputed()).isEqualTo(5);

        List<SimilarPhoto> similar = service.findSimilar("burst-2");
        assertThat(similar).extracting(SimilarPhoto::getPhotoId).containsExactly("burst-1", "burst-3");

        List<DuplicateGroup> duplicates = service.findDuplicates();
        assertThat(duplicates).hasSize(1);
        assertThat(duplicates.get(0).getAllIds()).containsExactly("burst-1", "burst-2", "burst-3");

        List<PhotoStack> stacks = service.buildStacks();
        assertThat(stacks).extracting(PhotoStack::getCount).containsExactly(3, 1, 1);
        assertThat(stacks.get(0).getPrimary().getId()).isEqualTo("burst-1");
    }

    @Test
    void unknownPhotoGivesEmptyResults() {
        assertThat(service.computeNow("nope")).isEmpty();
        assertThat(service.findSimilar("nope")).isEmpty();
    }

    @Test
    void computeNowReportsStatus() {
        assertThat(service.computeNow("dog")).get()
                .extracting(ComputeResult::getStatus).isEqualTo(ComputeResult.Status.COMPUTED);
        assertThat(service.computeNow("dog")).get()
                .extracting(ComputeResult::getStatus).isEqualTo(ComputeResult.Status.CACHED);
    }

    @Test
    void statsReportCoverage() {
        service.computeNow("dog");
        service.computeNow("beach");

        EmbeddingStats stats = service.getStats();

        assertThat(stats.getTotalPhotos()).isEqualTo(5);
        assertThat(stats.getPhotosWithEmbeddings()).isEqualTo(2);
        assertThat(stats.getCoveragePercentage()).isEqualTo(40);
        assertThat(stats.getPermanentFailures()).isZero();
    }

    @Test
    void cleanupDeletesEmbeddingsOfRemovedPhotos() {
        service.runScan(ProgressListener.NONE);
        index.source.remove("dog");

        assertThat(service.cleanupOrphans()).isEqualTo(1);
        assertThat(index.context.getStore().get("dog")).isEmpty();
        assertThat(index.context.getStore().size()).isEqualTo(4);
        assertThat(service.getStats().getCoverage()).isEqualTo(1f);
    }

    @Test
    @DisplayName("resetting failures lets a permanently failed photo be computed again")
    void resetFailuresRetriesPermanentFailures() {
        index.source.failDecoding("dog");
        for (int i = 0; i < 3; i++) {
            service.computeNow("dog");
        }
        assertThat(service.getStats().getPermanentFailures()).isEqualTo(1);
        index.source.fixDecoding("dog");
        assertThat(service.computeNow("dog")).get()
                .extracting(ComputeResult::getStatus).isEqualTo(ComputeResult.Status.PERMANENTLY_FAILED);

        service.resetFailures();

        assertThat(service.computeNow("dog")).get()
                .extracting(ComputeResult::getStatus).isEqualTo(ComputeResult.Status.COMPUTED);
    }

    @Test
    void backgroundScanFillsTheStore() throws Exception {
        ScanReport report = service.scanInBackground(ProgressListener.NONE).get(30, TimeUnit.SECONDS);

        assertThat(report.getComputed()).isEqualTo(5);
        assertThat(service.getStats().getCoverage()).isEqualTo(1f);
    }

    @Test
    @DisplayName("stacking an unindexed library starts a background scan")
    void stackingWithoutEmbeddingsRequestsScan() throws Exception {
        List<PhotoStack> stacks = service.buildStacks();
        assertThat(stacks).allSatisfy(s -> assertThat(s.isStack()).isFalse());

        // The requested scan keeps running on its own thread; wait for it through the same scheduler.
        service.scanInBackground(ProgressListener.NONE).get(30, TimeUnit.SECONDS);
        assertThat(index.context.getStore().size()).isEqualTo(5);

        service.newStackingSession();
        assertThat(service.buildStacks()).extracting(PhotoStack::getCount).containsExactly(3, 1, 1);
    }

    @Test
    void resetWatermarkClearsIt() {
        service.runScan(ProgressListener.NONE);
        assertThat(index.context.getMetadata().getWatermark()).isPresent();

        service.resetWatermark();

        assertThat(index.context.getMetadata().getWatermark()).isEmpty();
    }
}
