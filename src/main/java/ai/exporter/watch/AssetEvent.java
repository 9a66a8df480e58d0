package ai.exporter.watch;

import java.util.Objects;

import ai.exporter.repo.AssetHandle;

public record AssetEvent(AssetEventType type, AssetHandle handle) {

    public AssetEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handle, "handle");
    }

    public String assetKind() {
        return handle.kind();
    }
}
