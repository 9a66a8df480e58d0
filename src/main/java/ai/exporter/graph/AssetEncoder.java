package ai.exporter.graph;

import java.util.ArrayList;
import java.util.List;

import ai.exporter.document.AssetDocument;
import ai.exporter.document.ComponentRecord;
import ai.exporter.document.FunctionRecord;
import ai.exporter.document.GraphRecord;
import ai.exporter.document.VariableRecord;
import ai.exporter.model.Component;
import ai.exporter.model.Graph;
import ai.exporter.model.Node;
import ai.exporter.model.NodeKind;
import ai.exporter.model.Port;
import ai.exporter.model.ScriptAsset;
import ai.exporter.model.VariableDeclaration;

/**
 * Builds the export document of one script asset.
 * <p>
 * graphs = top-level graphs followed by function graphs.
 * functions re-walk each function graph for its signature and embed its graph again.
 * dependencies are taken from the top-level graphs only.
 */
public final class AssetEncoder {

    private AssetEncoder() {
    }

    public static AssetDocument serialize(ScriptAsset asset) {
        if (asset == null) {
            throw new InvalidAssetException("script asset is missing");
        }

        final List<GraphRecord> graphs = new ArrayList<>(asset.graphs().size() + asset.functionGraphs().size());
        for (Graph g : asset.graphs()) {
            graphs.add(GraphEncoder.encode(g));
        }
        for (Graph g : asset.functionGraphs()) {
            graphs.add(GraphEncoder.encode(g));
        }

        return new AssetDocument(
                asset.name(),
                asset.path(),
                AssetDocument.CLASS_TYPE,
                emptyToNull(asset.parentClass()),
                emptyToNull(asset.generatedClass()),
                graphs,
                variables(asset),
                functions(asset),
                components(asset),
                DependencyExtractor.extract(asset.graphs())
        );
    }

    static List<VariableRecord> variables(ScriptAsset asset) {
        final List<VariableRecord> out = new ArrayList<>(asset.variables().size());
        for (VariableDeclaration v : asset.variables()) {
            out.add(new VariableRecord(
                    v.name(),
                    TypeDescriptors.encode(v.type()),
                    v.category(),
                    v.exposed(),
                    emptyToNull(v.defaultValue())
            ));
        }
        return out;
    }

    static List<FunctionRecord> functions(ScriptAsset asset) {
        final List<FunctionRecord> out = new ArrayList<>(asset.functionGraphs().size());
        for (Graph g : asset.functionGraphs()) {
            out.add(new FunctionRecord(g.name(), parameters(g), GraphEncoder.encode(g)));
        }
        return out;
    }

    /** Non-exec output pins of every entry node of a function graph. */
    static List<FunctionRecord.Parameter> parameters(Graph functionGraph) {
        final List<FunctionRecord.Parameter> params = new ArrayList<>();
        for (Node node : functionGraph.nodes()) {
            if (NodeClassifier.classify(node) != NodeKind.FUNCTION_ENTRY) {
                continue;
            }
            for (Port pin : node.ports()) {
                if (pin.isOutput() && !pin.type().isExec()) {
                    params.add(new FunctionRecord.Parameter(pin.name(), TypeDescriptors.encode(pin.type())));
                }
            }
        }
        return params;
    }

    static List<ComponentRecord> components(ScriptAsset asset) {
        final List<ComponentRecord> out = new ArrayList<>();
        for (Component c : asset.components()) {
            if (c.hasTemplate()) {
                out.add(new ComponentRecord(c.variableName(), c.templateClass()));
            }
        }
        return out;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
