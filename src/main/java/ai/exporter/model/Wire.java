package ai.exporter.model;

import java.util.Objects;

/**
 * Directed link from an output port to an input port.
 */
public record Wire(PortRef from, PortRef to) {

    public Wire {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }
}
