package ai.exporter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import ai.exporter.model.Component;
import ai.exporter.model.Graph;
import ai.exporter.model.Node;
import ai.exporter.model.Port;
import ai.exporter.model.ScriptAsset;
import ai.exporter.model.TypeDescriptor;
import ai.exporter.model.VariableDeclaration;

/**
 * In-memory assets shared by the tests.
 */
public final class Fixtures {

    public static final String PRINT_OWNER = "/Script/Engine.KismetSystemLibrary";

    private Fixtures() {
    }

    /** The snapshot tree under src/test/resources/snapshots. */
    public static Path snapshotDir() {
        try {
            return Path.of(Fixtures.class.getResource("/snapshots").toURI());
        } catch (URISyntaxException ex) {
            throw new IllegalStateException(ex);
        }
    }

    /** Copies the snapshot tree into target, so tests can change it. */
    public static Path copySnapshots(Path target) throws IOException {
        final Path source = snapshotDir();
        try (Stream<Path> files = Files.walk(source)) {
            files.forEach(p -> {
                final Path dest = target.resolve(source.relativize(p).toString());
                try {
                    if (Files.isDirectory(p)) {
                        Files.createDirectories(dest);
                    } else {
                        Files.copy(p, dest);
                    }
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
            });
        }
        return target;
    }

    public static Node beginPlay() {
        return Node.builder("N1", "K2Node_Event")
                .extending("K2Node", "EdGraphNode")
                .title("Event BeginPlay")
                .port(Port.output("then", TypeDescriptor.of(TypeDescriptor.EXEC)))
                .build();
    }

    public static Node printString() {
        return Node.builder("N2", "K2Node_CallFunction")
                .extending("K2Node", "EdGraphNode")
                .title("Print String")
                .menuCategory("Utilities|String")
                .position(200, 0)
                .functionOwner(PRINT_OWNER)
                .port(Port.input("execute", TypeDescriptor.of(TypeDescriptor.EXEC)))
                .port(Port.input("InString", TypeDescriptor.of("string"))
                        .withDisplayName("In String")
                        .withDefaultValue("Hello"))
                .build();
    }

    public static Graph eventGraph() {
        return Graph.builder("EventGraph")
                .node(beginPlay())
                .node(printString())
                .link("N1", "then", "N2", "execute")
                .build();
    }

    public static Graph openDoorFunction() {
        return Graph.builder("OpenDoor")
                .node(Node.builder("F1", "K2Node_FunctionEntry")
                        .extending("K2Node_FunctionTerminator", "K2Node")
                        .title("Open Door")
                        .port(Port.output("then", TypeDescriptor.of(TypeDescriptor.EXEC)))
                        .port(Port.output("Speed", TypeDescriptor.of("real")))
                        .build())
                .build();
    }

    /** BeginPlay -> Print String("Hello"), no functions or variables. */
    public static ScriptAsset door() {
        return new ScriptAsset(
                "BP_Door",
                "/Game/BP_Door",
                "Actor",
                "BP_Door_C",
                List.of(eventGraph()),
                List.of(),
                List.of(),
                List.of());
    }

    public static ScriptAsset doorWithExtras() {
        return new ScriptAsset(
                "BP_Door",
                "/Game/Characters/BP_Door",
                "Actor",
                "BP_Door_C",
                List.of(eventGraph()),
                List.of(openDoorFunction()),
                List.of(new VariableDeclaration("IsOpen", TypeDescriptor.of("bool"), "State", true, "false"),
                        new VariableDeclaration("Targets", TypeDescriptor.of("object", "Actor").asCollection(),
                                "", false, null)),
                List.of(new Component("DoorMesh", "StaticMeshComponent"),
                        new Component("DefaultSceneRoot", null)));
    }
}
