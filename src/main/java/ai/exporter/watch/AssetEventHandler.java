package ai.exporter.watch;

@FunctionalInterface
public interface AssetEventHandler {

    void onEvent(AssetEvent event);
}
