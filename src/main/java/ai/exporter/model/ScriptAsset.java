package ai.exporter.model;

import java.util.List;
import java.util.Objects;

/**
 * Read-only view of one Blueprint asset, built by an asset repository for a single export call.
 * Callers must not mutate the underlying data while an export is running.
 */
public record ScriptAsset(
        String name,
        String path,
        String parentClass,     // null if none
        String generatedClass,  // null if none
        List<Graph> graphs,
        List<Graph> functionGraphs,
        List<VariableDeclaration> variables,
        List<Component> components
) {

    public static final String KIND = "Blueprint";

    public ScriptAsset {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        graphs = graphs == null ? List.of() : List.copyOf(graphs);
        functionGraphs = functionGraphs == null ? List.of() : List.copyOf(functionGraphs);
        variables = variables == null ? List.of() : List.copyOf(variables);
        components = components == null ? List.of() : List.copyOf(components);
    }
}
