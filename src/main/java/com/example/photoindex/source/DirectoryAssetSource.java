package com.example.photoindex.source;

import com.example.photoindex.PhotoIndexException;
import com.example.photoindex.extract.DecodedImage;
import com.example.photoindex.extract.OpenCvImages;
import com.example.photoindex.model.PhotoRef;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Asset source over a directory tree of image files. The photo id is the path relative to the root,
 * with '/' separators; creation and modification times come from the file system.
 */
public class DirectoryAssetSource implements AssetSource {

    private static final Logger log = LoggerFactory.getLogger(DirectoryAssetSource.class);

    private final Path root;

    public DirectoryAssetSource(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Invalid library folder: " + root);
        }
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public List<PhotoRef> enumerate(SortKey sortKey, Predicate<PhotoRef> filter) {
        List<PhotoRef> photos = new ArrayList<>();
        try (Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile)
                    .filter(DirectoryAssetSource::isImageFile)
                    .forEach(file -> {
                        PhotoRef ref = toPhotoRef(file);
                        if (ref != null && (filter == null || filter.test(ref))) {
                            photos.add(ref);
                        }
                    });
        } catch (IOException e) {
            throw new PhotoIndexException("Cannot read library folder: " + root, e);
        }
        photos.sort(sortKey.comparator());
        return photos;
    }

    @Override
    public DecodedImage loadImage(String id, int maxDimension) throws ImageDecodeException {
        if (maxDimension <= 0) {
            throw new IllegalArgumentException("maxDimension must be positive");
        }
        Path file = resolve(id);
        if (file == null || !Files.isRegularFile(file)) {
            throw new ImageDecodeException("Image file does not exist: " + id);
        }

        Mat image = opencv_imgcodecs.imread(file.toString(), opencv_imgcodecs.IMREAD_COLOR);
        try {
            if (image == null || image.empty()) {
                throw new ImageDecodeException("Failed to load image: " + id);
            }
            return OpenCvImages.fitWithin(image, maxDimension);
        } finally {
            if (image != null) {
                image.release();
            }
        }
    }

    @Override
    public Optional<PhotoRef> find(String id) {
        Path file = resolve(id);
        if (file == null || !Files.isRegularFile(file) || !isImageFile(file)) {
            return Optional.empty();
        }
        return Optional.ofNullable(toPhotoRef(file));
    }

    private Path resolve(String id) {
        if (id == null || id.isEmpty()) {
            return null;
        }
        Path file = root.resolve(id).normalize();
        // Ids never point outside the library.
        return file.startsWith(root) ? file : null;
    }

    private PhotoRef toPhotoRef(Path file) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            String id = root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
            return new PhotoRef(id, attrs.creationTime().toInstant(), attrs.lastModifiedTime().toInstant());
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
            return null;
        }
    }

    static boolean isImageFile(Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        // Skip hidden files (like .DS_Store on macOS)
        if (fileName.startsWith(".")) {
            return false;
        }
        return fileName.endsWith(".jpg") || fileName.endsWith(".jpeg")
                || fileName.endsWith(".png") || fileName.endsWith(".bmp")
                || fileName.endsWith(".webp") || fileName.endsWith(".tif") || fileName.endsWith(".tiff");
    }
}
