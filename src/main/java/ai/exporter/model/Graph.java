package ai.exporter.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One sub-graph of a script asset.
 * Nodes and their ports are index-addressable; wires are (port, port) index pairs,
 * so the graph holds no back-references.
 */
public record Graph(
        String name,
        List<Node> nodes,
        List<Wire> wires
) {

    public Graph {
        Objects.requireNonNull(name, "name");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        wires = wires == null ? List.of() : List.copyOf(wires);

        final Set<String> ids = new HashSet<>();
        for (Node n : nodes) {
            if (!ids.add(n.id())) {
                throw new IllegalArgumentException("duplicate node id in graph " + name + ": " + n.id());
            }
        }
        for (Wire w : wires) {
            checkRef(nodes, w.from(), name);
            checkRef(nodes, w.to(), name);
        }
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public Port port(PortRef ref) {
        return nodes.get(ref.node()).ports().get(ref.port());
    }

    public int indexOf(String nodeId) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id().equals(nodeId)) {
                return i;
            }
        }
        return -1;
    }

    /** Wires leaving the given port, in graph order. */
    public List<Wire> wiresFrom(PortRef source) {
        final List<Wire> out = new ArrayList<>();
        for (Wire w : wires) {
            if (w.from().equals(source)) {
                out.add(w);
            }
        }
        return out;
    }

    private static void checkRef(List<Node> nodes, PortRef ref, String graphName) {
        if (ref.node() >= nodes.size() || ref.port() >= nodes.get(ref.node()).ports().size()) {
            throw new IllegalArgumentException("wire points outside graph " + graphName + ": " + ref);
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Collects nodes, then links by (node id, port name); indices are resolved in {@link #build()}.
     */
    public static final class Builder {
        private final String name;
        private final List<Node> nodes = new ArrayList<>();
        private final List<String[]> links = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder node(Node node) {
            nodes.add(Objects.requireNonNull(node, "node"));
            return this;
        }

        public Builder link(String fromNode, String fromPort, String toNode, String toPort) {
            links.add(new String[]{fromNode, fromPort, toNode, toPort});
            return this;
        }

        public Graph build() {
            final Map<String, Integer> byId = new HashMap<>();
            for (int i = 0; i < nodes.size(); i++) {
                byId.putIfAbsent(nodes.get(i).id(), i);
            }
            final List<Wire> wires = new ArrayList<>(links.size());
            for (String[] l : links) {
                wires.add(new Wire(resolve(byId, l[0], l[1]), resolve(byId, l[2], l[3])));
            }
            return new Graph(name, nodes, wires);
        }

        private PortRef resolve(Map<String, Integer> byId, String nodeId, String portName) {
            final Integer nodeIndex = byId.get(nodeId);
            if (nodeIndex == null) {
                throw new IllegalArgumentException("unknown node in graph " + name + ": " + nodeId);
            }
            final int portIndex = nodes.get(nodeIndex).portIndex(portName);
            if (portIndex < 0) {
                throw new IllegalArgumentException("unknown pin " + nodeId + "." + portName + " in graph " + name);
            }
            return new PortRef(nodeIndex, portIndex);
        }
    }
}
