package ai.exporter.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ai.exporter.document.NodeRecord;
import ai.exporter.document.PinRecord;
import ai.exporter.model.Graph;
import ai.exporter.model.Node;
import ai.exporter.model.PortRef;
import ai.exporter.model.Wire;

public final class NodeEncoder {

    private NodeEncoder() {
    }

    public static NodeRecord encode(Graph graph, int nodeIndex) {
        final Node node = graph.node(nodeIndex);

        final List<PinRecord> pins = new ArrayList<>(node.ports().size());
        for (var port : node.ports()) {
            pins.add(PortEncoder.encode(port));
        }

        return new NodeRecord(
                node.id(),
                NodeClassifier.tag(node),
                node.title(),
                NodeClassifier.category(node),
                new NodeRecord.Position(node.x(), node.y()),
                pins,
                connectedNodes(graph, nodeIndex)
        );
    }

    /**
     * Ids of nodes fed by this node's output ports: ports in node order, wires in graph order,
     * each target listed once.
     */
    public static List<String> connectedNodes(Graph graph, int nodeIndex) {
        final Node node = graph.node(nodeIndex);
        final Set<String> connected = new LinkedHashSet<>();
        for (int p = 0; p < node.ports().size(); p++) {
            if (!node.ports().get(p).isOutput()) {
                continue;
            }
            for (Wire w : graph.wiresFrom(new PortRef(nodeIndex, p))) {
                connected.add(graph.node(w.to().node()).id());
            }
        }
        return new ArrayList<>(connected);
    }
}
