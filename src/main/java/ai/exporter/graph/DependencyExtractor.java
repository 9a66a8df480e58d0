package ai.exporter.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ai.exporter.model.Graph;
import ai.exporter.model.Node;
import ai.exporter.model.NodeKind;
import ai.exporter.model.Port;

/**
 * Collects external references of a set of graphs:
 * - owning type of every function a call node invokes
 * - default objects held by object-typed pins
 * <p>
 * Each path is kept once, at its first occurrence. Empty paths are skipped.
 */
public final class DependencyExtractor {

    private DependencyExtractor() {
    }

    public static List<String> extract(List<Graph> graphs) {
        final Set<String> unique = new LinkedHashSet<>();
        for (Graph graph : graphs) {
            for (Node node : graph.nodes()) {
                if (NodeClassifier.classify(node) == NodeKind.CALL_EXTERNAL_FUNCTION) {
                    add(unique, node.functionOwner());
                }
                for (Port port : node.ports()) {
                    if (port.type().isObjectReference()) {
                        add(unique, port.defaultObject());
                    }
                }
            }
        }
        return new ArrayList<>(unique);
    }

    private static void add(Set<String> unique, String path) {
        if (path != null && !path.isEmpty()) {
            unique.add(path);
        }
    }
}
