package ai.exporter.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One operation in a graph.
 * <p>
 * lineage lists the concrete node type first, then its supertypes
 * (e.g. K2Node_CustomEvent, K2Node_Event, K2Node, EdGraphNode).
 */
public record Node(
        String id,
        String nodeClass,
        List<String> lineage,
        String title,
        String menuCategory,   // null when the node has no menu category capability
        int x,
        int y,
        List<Port> ports,
        String functionOwner   // owning type path of the invoked external definition, or null
) {

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(nodeClass, "nodeClass");
        lineage = lineage == null || lineage.isEmpty() ? List.of(nodeClass) : List.copyOf(lineage);
        title = title == null ? "" : title;
        ports = ports == null ? List.of() : List.copyOf(ports);
    }

    public boolean isA(String typeName) {
        return lineage.contains(typeName);
    }

    public int portIndex(String portName) {
        for (int i = 0; i < ports.size(); i++) {
            if (ports.get(i).name().equals(portName)) {
                return i;
            }
        }
        return -1;
    }

    public static Builder builder(String id, String nodeClass) {
        return new Builder(id, nodeClass);
    }

    public static final class Builder {
        private final String id;
        private final String nodeClass;
        private final List<String> lineage = new ArrayList<>();
        private final List<Port> ports = new ArrayList<>();
        private String title;
        private String menuCategory;
        private int x;
        private int y;
        private String functionOwner;

        private Builder(String id, String nodeClass) {
            this.id = Objects.requireNonNull(id, "id");
            this.nodeClass = Objects.requireNonNull(nodeClass, "nodeClass");
            this.lineage.add(nodeClass);
        }

        public Builder extending(String... supertypes) {
            for (String s : supertypes) {
                if (!lineage.contains(s)) {
                    lineage.add(s);
                }
            }
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder menuCategory(String menuCategory) {
            this.menuCategory = menuCategory;
            return this;
        }

        public Builder position(int x, int y) {
            this.x = x;
            this.y = y;
            return this;
        }

        public Builder port(Port port) {
            ports.add(Objects.requireNonNull(port, "port"));
            return this;
        }

        public Builder functionOwner(String functionOwner) {
            this.functionOwner = functionOwner;
            return this;
        }

        public Node build() {
            return new Node(id, nodeClass, lineage, title, menuCategory, x, y, ports, functionOwner);
        }
    }
}
