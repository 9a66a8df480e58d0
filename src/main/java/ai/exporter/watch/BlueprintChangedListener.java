package ai.exporter.watch;

import ai.exporter.model.ScriptAsset;

@FunctionalInterface
public interface BlueprintChangedListener {

    void onBlueprintChanged(ScriptAsset blueprint);
}
