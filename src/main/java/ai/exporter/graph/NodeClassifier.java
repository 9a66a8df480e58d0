package ai.exporter.graph;

import ai.exporter.model.Node;
import ai.exporter.model.NodeKind;

/**
 * Maps a node to exactly one {@link NodeKind}. Kinds are tried in declaration order,
 * so a node whose lineage matches several kinds gets the first one.
 */
public final class NodeClassifier {

    private NodeClassifier() {
    }

    public static NodeKind classify(Node node) {
        for (NodeKind kind : NodeKind.values()) {
            if (kind.definingType() != null && node.isA(kind.definingType())) {
                return kind;
            }
        }
        return NodeKind.OTHER;
    }

    /** Kind tag, or the concrete node class for {@link NodeKind#OTHER}. */
    public static String tag(Node node) {
        final NodeKind kind = classify(node);
        return kind == NodeKind.OTHER ? node.nodeClass() : kind.tag();
    }

    /** Menu category when the node supports one, else "". */
    public static String category(Node node) {
        return node.menuCategory() == null ? "" : node.menuCategory();
    }
}
