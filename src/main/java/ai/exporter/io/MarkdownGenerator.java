package ai.exporter.io;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.exporter.document.AssetDocument;
import ai.exporter.document.ComponentRecord;
import ai.exporter.document.FunctionRecord;
import ai.exporter.document.GraphRecord;
import ai.exporter.document.NodeRecord;
import ai.exporter.document.PinRecord;
import ai.exporter.document.VariableRecord;

/**
 * Human-readable rendering of an export document: header, components, variables,
 * function signatures, node-by-node graph logic and the first dependencies.
 */
public final class MarkdownGenerator {

    static final int MAX_CHAIN_STEPS = 50;
    static final int MAX_DEPENDENCIES = 10;

    private MarkdownGenerator() {
    }

    public static String generate(AssetDocument doc, String exportedAt) {
        Objects.requireNonNull(doc, "doc");
        final StringBuilder md = new StringBuilder();

        md.append("# ").append(doc.name()).append("\n\n");
        md.append("**Type:** ").append(doc.classType()).append("\n");
        md.append("**Path:** `").append(doc.path()).append("`\n");
        md.append("**Parent Class:** ").append(orNone(doc.parentClass())).append("\n");
        md.append("**Generated Class:** ").append(orNone(doc.generatedClass())).append("\n");
        if (exportedAt != null) {
            md.append("**Exported:** ").append(exportedAt).append("\n");
        }
        md.append("\n");

        if (!doc.components().isEmpty()) {
            md.append("## Components\n\n");
            for (ComponentRecord c : doc.components()) {
                md.append("- **").append(c.name()).append("** (").append(c.className()).append(")\n");
            }
            md.append("\n");
        }

        if (!doc.variables().isEmpty()) {
            md.append("## Variables\n\n");
            md.append("| Name | Type | Category | Exposed | Default |\n");
            md.append("|------|------|----------|---------|---------|\n");
            for (VariableRecord v : doc.variables()) {
                md.append("| ").append(v.name())
                        .append(" | ").append(v.type())
                        .append(" | ").append(v.category())
                        .append(" | ").append(v.exposed())
                        .append(" | ").append(v.defaultValue() == null ? "" : v.defaultValue())
                        .append(" |\n");
            }
            md.append("\n");
        }

        if (!doc.functions().isEmpty()) {
            md.append("## Functions\n\n");
            for (FunctionRecord f : doc.functions()) {
                final List<String> params = new ArrayList<>(f.parameters().size());
                for (FunctionRecord.Parameter p : f.parameters()) {
                    params.add(p.name() + ": " + p.type());
                }
                md.append("### ").append(f.name()).append("(").append(String.join(", ", params)).append(")\n\n");
            }
        }

        if (!doc.graphs().isEmpty()) {
            md.append("## Graphs & Node Logic\n\n");
            for (GraphRecord g : doc.graphs()) {
                md.append("### ").append(g.name()).append("\n\n");
                md.append("**Total Nodes:** ").append(g.nodes().size()).append("\n\n");
                if (!g.nodes().isEmpty()) {
                    appendNodeGraph(md, g.nodes());
                }
            }
        }

        if (!doc.dependencies().isEmpty()) {
            md.append("## Dependencies\n\n");
            final int n = Math.min(MAX_DEPENDENCIES, doc.dependencies().size());
            for (int i = 0; i < n; i++) {
                md.append("- `").append(doc.dependencies().get(i)).append("`\n");
            }
            md.append("\n");
        }

        return md.toString();
    }

    private static void appendNodeGraph(StringBuilder md, List<NodeRecord> nodes) {
        final Map<String, NodeRecord> byId = new LinkedHashMap<>();
        for (NodeRecord n : nodes) {
            byId.put(n.id(), n);
        }

        final List<NodeRecord> events = new ArrayList<>();
        final List<NodeRecord> calls = new ArrayList<>();
        final List<NodeRecord> variables = new ArrayList<>();
        for (NodeRecord n : nodes) {
            if (n.type().contains("Event")) {
                events.add(n);
            } else if (n.type().contains("CallFunction")) {
                calls.add(n);
            } else if (n.type().contains("Variable")) {
                variables.add(n);
            }
        }

        if (!events.isEmpty()) {
            md.append("#### Execution Flow\n\n");
            for (NodeRecord e : events) {
                appendExecutionChain(md, e, byId);
            }
            md.append("\n");
        }

        if (!calls.isEmpty()) {
            md.append("#### Function Calls\n\n");
            for (NodeRecord c : calls) {
                md.append("- **").append(oneLine(c.title())).append("**");
                if (!c.category().isEmpty()) {
                    md.append(" _").append(c.category()).append("_");
                }
                md.append("\n");
                appendPins(md, c.pins(), "input", "  - Parameters:\n", "    ");
                appendPins(md, c.pins(), "output", "  - Returns:\n", "    ");
                md.append("\n");
            }
            md.append("\n");
        }

        if (!variables.isEmpty()) {
            md.append("#### Variables Used\n\n");
            for (NodeRecord v : variables) {
                md.append("- **").append(oneLine(v.title())).append("** (").append(v.type()).append(")\n");
            }
            md.append("\n");
        }

        md.append("#### All Nodes (Detailed)\n\n");
        int index = 1;
        for (NodeRecord n : nodes) {
            md.append("**Node ").append(index++).append(": ").append(oneLine(n.title())).append("**\n");
            md.append("- Type: `").append(n.type()).append("`\n");
            if (!n.category().isEmpty()) {
                md.append("- Category: `").append(n.category()).append("`\n");
            }
            md.append("- ID: `").append(n.id()).append("`\n");
            md.append("- Position: (").append(n.position().x()).append(", ").append(n.position().y()).append(")\n");
            if (!n.pins().isEmpty()) {
                md.append("- Pins:\n");
                for (PinRecord p : n.pins()) {
                    md.append("  - [").append(p.direction()).append("] `").append(p.displayName())
                            .append("`: ").append(p.type());
                    if (p.defaultValue() != null) {
                        md.append(" = `").append(p.defaultValue()).append("`");
                    }
                    md.append("\n");
                }
            }
            if (!n.connections().isEmpty()) {
                final List<String> quoted = new ArrayList<>(n.connections().size());
                for (String c : n.connections()) {
                    quoted.add("`" + c + "`");
                }
                md.append("- Connected to: ").append(String.join(", ", quoted)).append("\n");
            }
            md.append("\n");
        }
    }

    /** Follows the first known connection from an event node until a cycle or the step limit. */
    private static void appendExecutionChain(StringBuilder md, NodeRecord start, Map<String, NodeRecord> byId) {
        md.append("**").append(oneLine(start.title())).append("**\n\n");
        final Set<String> visited = new HashSet<>();
        NodeRecord current = start;
        int step = 1;
        while (current != null && visited.add(current.id())) {
            md.append(step).append(". **").append(oneLine(current.title())).append("** `[")
                    .append(current.type()).append("]`\n");
            appendPins(md, current.pins(), "input", "   - Inputs:\n", "     ");
            appendPins(md, current.pins(), "output", "   - Outputs:\n", "     ");
            md.append("\n");

            NodeRecord next = null;
            for (String id : current.connections()) {
                next = byId.get(id);
                if (next != null) {
                    break;
                }
            }
            current = next;
            step++;
            if (step > MAX_CHAIN_STEPS) {
                md.append("   _(Execution chain continues...)_\n\n");
                break;
            }
        }
        md.append("\n");
    }

    private static void appendPins(StringBuilder md, List<PinRecord> pins, String direction,
                                   String heading, String indent) {
        boolean first = true;
        for (PinRecord p : pins) {
            if (!direction.equals(p.direction()) || "exec".equalsIgnoreCase(p.type())) {
                continue;
            }
            if (first) {
                md.append(heading);
                first = false;
            }
            md.append(indent).append("- ").append(p.displayName()).append(": `").append(p.type()).append("`");
            if (p.defaultValue() != null) {
                md.append(" = `").append(p.defaultValue()).append("`");
            }
            md.append("\n");
        }
    }

    private static String oneLine(String title) {
        return title == null ? "Unknown" : title.replace("\n", " - ");
    }

    private static String orNone(String s) {
        return s == null ? "None" : s;
    }
}
