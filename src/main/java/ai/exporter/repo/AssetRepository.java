package ai.exporter.repo;

import java.io.IOException;
import java.util.List;

import ai.exporter.model.ScriptAsset;

public interface AssetRepository {

    /** All assets of the given kind, in a stable order. */
    List<AssetHandle> queryByKind(String kind) throws IOException;

    /**
     * Loads the read-only view of an asset.
     *
     * @throws AssetResolutionException if the asset vanished or cannot be read; callers skip it
     */
    ScriptAsset resolve(AssetHandle handle) throws AssetResolutionException;
}
