package ai.exporter.model;

import java.util.Objects;

public record VariableDeclaration(
        String name,
        TypeDescriptor type,
        String category,
        boolean exposed,       // expose-on-spawn
        String defaultValue    // rendered literal, or null
) {

    public VariableDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        category = category == null ? "" : category;
    }
}
