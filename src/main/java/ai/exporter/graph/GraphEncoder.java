package ai.exporter.graph;

import java.util.ArrayList;
import java.util.List;

import ai.exporter.document.GraphRecord;
import ai.exporter.document.NodeRecord;
import ai.exporter.model.Graph;

public final class GraphEncoder {

    private GraphEncoder() {
    }

    /** Nodes are written in the order the graph holds them; no sorting. */
    public static GraphRecord encode(Graph graph) {
        final List<NodeRecord> nodes = new ArrayList<>(graph.nodes().size());
        for (int i = 0; i < graph.nodes().size(); i++) {
            nodes.add(NodeEncoder.encode(graph, i));
        }
        return new GraphRecord(graph.name(), nodes);
    }
}
