package com.example.photoindex.source;

import com.example.photoindex.model.PhotoRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryAssetSourceTest {

    @TempDir
    Path root;

    private DirectoryAssetSource source;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("2024/trip"));
        Files.write(root.resolve("a.jpg"), new byte[]{1});
        Files.write(root.resolve("2024/trip/b.PNG"), new byte[]{1});
        Files.write(root.resolve("notes.txt"), new byte[]{1});
        Files.write(root.resolve(".DS_Store"), new byte[]{1});
        Files.write(root.resolve("2024/.hidden.jpg"), new byte[]{1});
        source = new DirectoryAssetSource(root);
    }

    @Test
    void enumeratesImagesWithSlashSeparatedIds() {
        List<PhotoRef> photos = source.enumerate(SortKey.CREATION_TIME_ASCENDING, null);

        assertThat(photos).extracting(PhotoRef::getId).containsExactlyInAnyOrder("a.jpg", "2024/trip/b.PNG");
        assertThat(source.count()).isEqualTo(2);
    }

    @Test
    void appliesFilter() {
        List<PhotoRef> photos = source.enumerate(SortKey.CREATION_TIME_DESCENDING,
                p -> p.getId().startsWith("2024/"));

        assertThat(photos).extracting(PhotoRef::getId).containsExactly("2024/trip/b.PNG");
    }

    @Test
    void readsModificationTime() throws Exception {
        Instant modified = Instant.parse("2023-07-04T12:00:00Z");
        Files.setLastModifiedTime(root.resolve("a.jpg"), FileTime.from(modified));

        assertThat(source.find("a.jpg")).get().extracting(PhotoRef::getModificationTime).isEqualTo(modified);
    }

    @Test
    void findsOnlyImagesInsideTheLibrary() {
        assertThat(source.exists("2024/trip/b.PNG")).isTrue();
        assertThat(source.exists("notes.txt")).isFalse();
        assertThat(source.exists("missing.jpg")).isFalse();
        assertThat(source.exists("../outside.jpg")).isFalse();
    }

    @Test
    void missingFileIsADecodeFailure() {
        assertThatThrownBy(() -> source.loadImage("gone.jpg", 512)).isInstanceOf(ImageDecodeException.class);
    }

    @Test
    void recognisesImageExtensions() {
        assertThat(DirectoryAssetSource.isImageFile(Path.of("x.JPEG"))).isTrue();
        assertThat(DirectoryAssetSource.isImageFile(Path.of("x.webp"))).isTrue();
        assertThat(DirectoryAssetSource.isImageFile(Path.of("x.gif"))).isFalse();
        assertThat(DirectoryAssetSource.isImageFile(Path.of(".x.jpg"))).isFalse();
    }

    @Test
    void rejectsMissingRoot() {
        assertThatThrownBy(() -> new DirectoryAssetSource(root.resolve("nope")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
