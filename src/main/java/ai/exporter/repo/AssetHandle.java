package ai.exporter.repo;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identifies one asset known to a repository.
 * source is where the repository reads it from (null for repositories that are not file-backed).
 */
public record AssetHandle(String path, String kind, Path source) {

    public AssetHandle {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
    }
}
