package ai.exporter.io;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.exporter.Fixtures;
import ai.exporter.model.Graph;
import ai.exporter.model.Node;
import ai.exporter.model.Port;
import ai.exporter.model.PortDirection;
import ai.exporter.model.ScriptAsset;
import ai.exporter.model.TypeDescriptor;
import ai.exporter.repo.AssetHandle;
import ai.exporter.repo.AssetResolutionException;

class AssetSnapshotReaderTest {

    private final AssetSnapshotReader reader = new AssetSnapshotReader();

    private static Path door() {
        return Fixtures.snapshotDir().resolve("Characters/BP_Door.json");
    }

    @Test
    void readsHeader() throws Exception {
        final AssetHandle handle = reader.readHeader(door());

        assertEquals("/Game/Characters/BP_Door", handle.path());
        assertEquals("Blueprint", handle.kind());
        assertEquals(door(), handle.source());
    }

    @Test
    void kindDefaultsToBlueprint() throws Exception {
        final AssetHandle handle = reader.readHeader(Fixtures.snapshotDir().resolve("Props/BP_Lamp.json"));

        assertEquals(ScriptAsset.KIND, handle.kind());
    }

    @Test
    void readsAssetHeaderFields() throws Exception {
        final ScriptAsset asset = reader.read(door());

        assertEquals("BP_Door", asset.name());
        assertEquals("Actor", asset.parentClass());
        assertEquals("BP_Door_C", asset.generatedClass());
        assertEquals(1, asset.graphs().size());
        assertEquals(1, asset.functionGraphs().size());
    }

    @Test
    @DisplayName("links come from output pins; input-side lists do not duplicate wires")
    void readsGraphAndLinks() throws Exception {
        final Graph g = reader.read(door()).graphs().get(0);

        assertEquals("EventGraph", g.name());
        assertEquals(2, g.nodes().size());
        assertEquals(1, g.wires().size());
        assertEquals("N1", g.node(g.wires().get(0).from().node()).id());
        assertEquals("execute", g.port(g.wires().get(0).to()).name());

        final Node print = g.node(1);
        assertTrue(print.isA("K2Node"));
        assertEquals("Utilities|String", print.menuCategory());
        assertEquals("/Script/Engine.KismetSystemLibrary", print.functionOwner());
        assertEquals(200, print.x());

        final Port in = print.ports().get(1);
        assertEquals("In String", in.displayName());
        assertEquals(PortDirection.INPUT, in.direction());
        assertEquals("Hello", in.defaultValue());
    }

    @Test
    void variablesAndComponents() throws Exception {
        final ScriptAsset asset = reader.read(door());

        assertEquals(2, asset.variables().size());
        assertEquals("false", asset.variables().get(0).defaultValue());
        assertTrue(asset.variables().get(0).exposed());
        assertEquals("2.0", asset.variables().get(1).defaultValue());
        assertFalse(asset.variables().get(1).exposed());

        assertEquals(2, asset.components().size());
        assertFalse(asset.components().get(1).hasTemplate());
    }

    @Test
    void objectPinKeepsDefaultObject() throws Exception {
        final ScriptAsset lamp = reader.read(Fixtures.snapshotDir().resolve("Props/BP_Lamp.json"));
        final Port light = lamp.graphs().get(0).node(0).ports().get(0);

        assertEquals(TypeDescriptor.of("object", "PointLightComponent"), light.type());
        assertEquals("/Game/Props/Lights/PL_Warm", light.defaultObject());
        assertNull(light.defaultValue());
    }

    @Test
    void typeAcceptsPlainString() throws Exception {
        final ObjectMapper mapper = new ObjectMapper();

        assertEquals(TypeDescriptor.of("exec"), AssetSnapshotReader.toType(mapper.readTree("\"exec\"")));
        assertEquals(TypeDescriptor.of("int").asCollection(),
                AssetSnapshotReader.toType(mapper.readTree("{\"category\":\"int\",\"is_array\":true}")));
    }

    @Test
    void unknownLinkTargetIsRejected(@TempDir Path tmp) throws Exception {
        final Path file = tmp.resolve("bad.json");
        Files.writeString(file, "{\"name\":\"BP\",\"path\":\"/Game/BP\",\"graphs\":[{\"name\":\"G\",\"nodes\":["
                + "{\"id\":\"A\",\"class\":\"K2Node_Event\",\"pins\":[{\"name\":\"then\",\"direction\":\"output\","
                + "\"type\":\"exec\",\"linked_to\":[\"Missing.execute\"]}]}]}]}");

        assertThrows(AssetResolutionException.class, () -> reader.read(file));
    }

    @Test
    void invalidJsonIsRejected(@TempDir Path tmp) throws Exception {
        final Path file = tmp.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertThrows(AssetResolutionException.class, () -> reader.read(file));
    }

    @Test
    void headerRequiresPath(@TempDir Path tmp) throws Exception {
        final Path file = tmp.resolve("nopath.json");
        Files.writeString(file, "{\"name\":\"BP\"}");

        assertThrows(IOException.class, () -> reader.readHeader(file));
    }
}
