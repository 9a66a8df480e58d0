package ai.exporter.repo;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.exporter.Fixtures;
import ai.exporter.model.ScriptAsset;

class FileAssetRepositoryTest {

    @Test
    void listsBlueprintsInPathOrder(@TempDir Path tmp) throws Exception {
        final FileAssetRepository repo = new FileAssetRepository(Fixtures.copySnapshots(tmp));

        final List<AssetHandle> handles = repo.queryByKind(ScriptAsset.KIND);

        assertEquals(2, handles.size());
        assertEquals("/Game/Characters/BP_Door", handles.get(0).path());
        assertEquals("/Game/Props/BP_Lamp.BP_Lamp", handles.get(1).path());
    }

    @Test
    void filtersByKind(@TempDir Path tmp) throws Exception {
        final FileAssetRepository repo = new FileAssetRepository(Fixtures.copySnapshots(tmp));

        final List<AssetHandle> tables = repo.queryByKind("DataTable");

        assertEquals(1, tables.size());
        assertEquals("/Game/Props/DT_Items", tables.get(0).path());
    }

    @Test
    void skipsHiddenExcludedAndBrokenFiles(@TempDir Path tmp) throws Exception {
        Fixtures.copySnapshots(tmp);
        final Path docs = tmp.resolve("docs");
        Files.createDirectories(tmp.resolve(".cache"));
        Files.createDirectories(docs);
        Files.copy(tmp.resolve("Characters/BP_Door.json"), tmp.resolve(".cache/BP_Door.json"));
        Files.copy(tmp.resolve("Characters/BP_Door.json"), docs.resolve("BP_Door.json"));
        Files.writeString(tmp.resolve("broken.json"), "{ nope");

        final FileAssetRepository repo = new FileAssetRepository(tmp, docs);

        assertEquals(2, repo.queryByKind(ScriptAsset.KIND).size());
        assertTrue(repo.isSkippedDirectory(docs));
        assertFalse(repo.isSkippedDirectory(tmp));
    }

    @Test
    void resolvesHandle(@TempDir Path tmp) throws Exception {
        final FileAssetRepository repo = new FileAssetRepository(Fixtures.copySnapshots(tmp));
        final AssetHandle door = repo.queryByKind(ScriptAsset.KIND).get(0);

        final ScriptAsset asset = repo.resolve(door);

        assertEquals("BP_Door", asset.name());
    }

    @Test
    void resolveFailsWhenFileIsGone(@TempDir Path tmp) throws Exception {
        final FileAssetRepository repo = new FileAssetRepository(Fixtures.copySnapshots(tmp));
        final AssetHandle door = repo.queryByKind(ScriptAsset.KIND).get(0);
        Files.delete(door.source());

        assertThrows(AssetResolutionException.class, () -> repo.resolve(door));
    }

    @Test
    void missingRootIsAnError(@TempDir Path tmp) {
        final FileAssetRepository repo = new FileAssetRepository(tmp.resolve("nothing-here"));

        assertThrows(IOException.class, () -> repo.queryByKind(ScriptAsset.KIND));
    }
}
