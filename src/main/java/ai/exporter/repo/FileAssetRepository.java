package ai.exporter.repo;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.exporter.io.AssetSnapshotReader;
import ai.exporter.model.ScriptAsset;

/**
 * Asset repository over a directory of snapshot files (*.json, any depth).
 * Unreadable files are skipped with a warning when listing.
 */
public final class FileAssetRepository implements AssetRepository {

    private static final Logger log = LoggerFactory.getLogger(FileAssetRepository.class);

    private final Path root;
    private final AssetSnapshotReader reader;
    private final Path excluded; // nullable; usually the export output dir

    public FileAssetRepository(Path root) {
        this(root, new AssetSnapshotReader(), null);
    }

    public FileAssetRepository(Path root, Path excluded) {
        this(root, new AssetSnapshotReader(), excluded);
    }

    public FileAssetRepository(Path root, AssetSnapshotReader reader, Path excluded) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.reader = Objects.requireNonNull(reader, "reader");
        this.excluded = excluded == null ? null : excluded.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public List<AssetHandle> queryByKind(String kind) throws IOException {
        Objects.requireNonNull(kind, "kind");
        if (!Files.isDirectory(root)) {
            throw new IOException("snapshot root is not a directory: " + root);
        }

        final List<Path> files = findSnapshotFiles();
        final List<AssetHandle> out = new ArrayList<>(files.size());
        for (Path file : files) {
            final AssetHandle handle = handleFor(file);
            if (handle != null && kind.equals(handle.kind())) {
                out.add(handle);
            }
        }
        return out;
    }

    /** True for hidden directories below the root and for the excluded directory. */
    public boolean isSkippedDirectory(Path dir) {
        final Path norm = dir.toAbsolutePath().normalize();
        if (norm.equals(root)) {
            return false;
        }
        final Path name = norm.getFileName();
        return (name != null && name.toString().startsWith(".")) || norm.equals(excluded);
    }

    /** Header of a single snapshot file, or null if it cannot be read. */
    public AssetHandle handleFor(Path file) {
        try {
            return reader.readHeader(file);
        } catch (IOException ex) {
            log.warn("Skipping unreadable snapshot {}: {}", file, ex.getMessage());
            return null;
        }
    }

    @Override
    public ScriptAsset resolve(AssetHandle handle) throws AssetResolutionException {
        Objects.requireNonNull(handle, "handle");
        final Path file = handle.source();
        if (file == null || !Files.isRegularFile(file)) {
            throw new AssetResolutionException("snapshot no longer exists for " + handle.path());
        }
        return reader.read(file);
    }

    private List<Path> findSnapshotFiles() throws IOException {
        final List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (isSkippedDirectory(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                final String name = file.getFileName().toString();
                if (attrs.isRegularFile() && name.endsWith(".json")) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(files);
        return files;
    }
}
