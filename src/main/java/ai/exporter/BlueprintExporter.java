package ai.exporter;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.exporter.document.AssetDocument;
import ai.exporter.graph.AssetEncoder;
import ai.exporter.graph.InvalidAssetException;
import ai.exporter.io.DocumentWriter;
import ai.exporter.model.ScriptAsset;
import ai.exporter.repo.AssetHandle;
import ai.exporter.repo.AssetRepository;
import ai.exporter.repo.AssetResolutionException;

/**
 * Export entry points. Failures never propagate: single exports report false
 * (or the "{}" placeholder), batch exports count successes.
 */
public final class BlueprintExporter {

    private static final Logger log = LoggerFactory.getLogger(BlueprintExporter.class);

    public static final String EMPTY_DOCUMENT = "{}";

    private final AssetRepository repository;
    private final DocumentWriter writer;
    private final Clock clock;

    public BlueprintExporter(AssetRepository repository, DocumentWriter writer) {
        this(repository, writer, Clock.systemUTC());
    }

    public BlueprintExporter(AssetRepository repository, DocumentWriter writer, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Full document as JSON, or {@value #EMPTY_DOCUMENT} when the asset is missing. */
    public String extractBlueprintData(ScriptAsset asset) {
        try {
            return writer.toJson(AssetEncoder.serialize(asset));
        } catch (InvalidAssetException ex) {
            log.error("extractBlueprintData: {}", ex.getMessage());
            return EMPTY_DOCUMENT;
        } catch (JsonProcessingException ex) {
            log.error("extractBlueprintData: cannot render {}: {}", asset.path(), ex.getMessage());
            return EMPTY_DOCUMENT;
        }
    }

    /** Writes the JSON document of one asset to an explicit file. */
    public boolean exportToFile(ScriptAsset asset, Path file) {
        if (asset == null) {
            log.error("exportToFile: script asset is missing");
            return false;
        }
        final String json;
        try {
            json = writer.toJson(AssetEncoder.serialize(asset));
        } catch (JsonProcessingException ex) {
            log.error("exportToFile: cannot render {}: {}", asset.path(), ex.getMessage());
            return false;
        }
        try {
            writer.writeJson(file, json);
            log.info("Exported blueprint to: {}", file);
            return true;
        } catch (IOException ex) {
            log.error("Failed to save file: {}: {}", file, ex.getMessage());
            return false;
        }
    }

    /** Writes JSON (and Markdown when enabled) at the asset's mirrored location below the output dir. */
    public boolean export(ScriptAsset asset) {
        final AssetDocument doc;
        try {
            doc = AssetEncoder.serialize(asset);
        } catch (InvalidAssetException ex) {
            log.error("export: {}", ex.getMessage());
            return false;
        }
        try {
            final Path json = writer.write(doc, now());
            log.info("Exported {} -> {}", doc.path(), json);
            return true;
        } catch (IOException ex) {
            log.error("Failed to export {}: {}", doc.path(), ex.getMessage());
            return false;
        }
    }

    /**
     * Re-exports one changed asset and, when Markdown is enabled, rewrites the index
     * so that it lists assets added after the initial export.
     */
    public boolean exportChanged(ScriptAsset asset) {
        if (!export(asset)) {
            return false;
        }
        if (writer.markdown()) {
            try {
                writer.writeIndex(now());
            } catch (IOException ex) {
                log.error("Failed to update {}: {}", DocumentWriter.INDEX_FILE, ex.getMessage());
                return false;
            }
        }
        return true;
    }

    /**
     * Exports every Blueprint the repository knows. Assets that cannot be resolved are skipped.
     *
     * @return number of assets written
     */
    public int exportAll() throws IOException {
        final List<AssetHandle> handles = repository.queryByKind(ScriptAsset.KIND);
        int exported = 0;
        for (AssetHandle handle : handles) {
            final ScriptAsset asset;
            try {
                asset = repository.resolve(handle);
            } catch (AssetResolutionException ex) {
                log.warn("Skipping {}: {}", handle.path(), ex.getMessage());
                continue;
            }
            if (export(asset)) {
                exported++;
            }
        }
        if (writer.markdown()) {
            writer.writeIndex(now());
        }
        log.info("Exported {} of {} blueprints to {}", exported, handles.size(), writer.outDir());
        return exported;
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
