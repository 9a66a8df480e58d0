package ai.exporter.watch;

public enum AssetEventType {
    ASSET_ADDED,
    ASSET_REMOVED,
    ASSET_MODIFIED
}
