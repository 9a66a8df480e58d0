package ai.exporter.model;

import java.util.Objects;

/**
 * One typed slot on a node. Links are not stored here; see {@link Graph#wires()}.
 */
public record Port(
        String name,            // unique within the owning node
        String displayName,
        PortDirection direction,
        TypeDescriptor type,
        String defaultValue,    // rendered literal, or null when wired / engine default
        String defaultObject    // path of a default object reference, or null
) {

    public Port {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(type, "type");
        displayName = displayName == null ? name : displayName;
    }

    public static Port input(String name, TypeDescriptor type) {
        return new Port(name, name, PortDirection.INPUT, type, null, null);
    }

    public static Port output(String name, TypeDescriptor type) {
        return new Port(name, name, PortDirection.OUTPUT, type, null, null);
    }

    public Port withDefaultValue(String literal) {
        return new Port(name, displayName, direction, type, literal, defaultObject);
    }

    public Port withDefaultObject(String objectPath) {
        return new Port(name, displayName, direction, type, defaultValue, objectPath);
    }

    public Port withDisplayName(String display) {
        return new Port(name, display, direction, type, defaultValue, defaultObject);
    }

    public boolean isOutput() {
        return direction == PortDirection.OUTPUT;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null && !defaultValue.isEmpty();
    }
}
