package ai.exporter.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.exporter.graph.LiteralRenderer;
import ai.exporter.model.Component;
import ai.exporter.model.Graph;
import ai.exporter.model.Node;
import ai.exporter.model.Port;
import ai.exporter.model.PortDirection;
import ai.exporter.model.ScriptAsset;
import ai.exporter.model.TypeDescriptor;
import ai.exporter.model.VariableDeclaration;
import ai.exporter.repo.AssetHandle;
import ai.exporter.repo.AssetResolutionException;

/**
 * Reads asset snapshots: JSON dumps of a Blueprint's raw graph data, one file per asset.
 * <p>
 * Links are taken from the "linked_to" lists of output pins only ("NodeId.PinName");
 * input-side lists are ignored so that each wire is created once.
 */
public final class AssetSnapshotReader {

    private final ObjectMapper mapper;

    public AssetSnapshotReader() {
        this(new ObjectMapper());
    }

    public AssetSnapshotReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /** Reads only kind and path, for repository listings. */
    public AssetHandle readHeader(Path file) throws IOException {
        final JsonNode root = mapper.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("not a JSON object: " + file);
        }
        final String path = text(root, "path");
        if (path == null || path.isBlank()) {
            throw new IOException("snapshot has no asset path: " + file);
        }
        final String kind = text(root, "kind");
        return new AssetHandle(path, kind == null ? ScriptAsset.KIND : kind, file);
    }

    public ScriptAsset read(Path file) throws AssetResolutionException {
        final JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException ex) {
            throw new AssetResolutionException("cannot read snapshot " + file + ": " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new AssetResolutionException("not a JSON object: " + file);
        }
        try {
            return toAsset(root);
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new AssetResolutionException("malformed snapshot " + file + ": " + ex.getMessage(), ex);
        }
    }

    ScriptAsset toAsset(JsonNode root) {
        final String name = required(root, "name");
        final String path = required(root, "path");

        final List<Graph> graphs = new ArrayList<>();
        for (JsonNode g : root.path("graphs")) {
            graphs.add(toGraph(g));
        }
        final List<Graph> functionGraphs = new ArrayList<>();
        for (JsonNode g : root.path("function_graphs")) {
            functionGraphs.add(toGraph(g));
        }

        final List<VariableDeclaration> variables = new ArrayList<>();
        for (JsonNode v : root.path("variables")) {
            final TypeDescriptor type = toType(v.path("type"));
            variables.add(new VariableDeclaration(
                    required(v, "name"),
                    type,
                    text(v, "category"),
                    v.path("exposed").asBoolean(false),
                    LiteralRenderer.render(type, v.get("default"))
            ));
        }

        final List<Component> components = new ArrayList<>();
        for (JsonNode c : root.path("components")) {
            components.add(new Component(required(c, "name"), text(c, "template_class")));
        }

        return new ScriptAsset(
                name,
                path,
                text(root, "parent_class"),
                text(root, "generated_class"),
                graphs,
                functionGraphs,
                variables,
                components
        );
    }

    Graph toGraph(JsonNode g) {
        final Graph.Builder builder = Graph.builder(required(g, "name"));

        for (JsonNode n : g.path("nodes")) {
            final String nodeId = required(n, "id");
            final Node.Builder node = Node.builder(nodeId, required(n, "class"))
                    .title(text(n, "title"))
                    .menuCategory(text(n, "menu_category"))
                    .position(n.path("x").asInt(0), n.path("y").asInt(0))
                    .functionOwner(text(n, "function_owner"));
            for (JsonNode t : n.path("lineage")) {
                node.extending(t.asText());
            }

            for (JsonNode p : n.path("pins")) {
                final Port port = toPort(p);
                node.port(port);
                if (!port.isOutput()) {
                    continue;
                }
                for (JsonNode link : p.path("linked_to")) {
                    final String target = link.asText();
                    final int dot = target.indexOf('.');
                    if (dot <= 0 || dot == target.length() - 1) {
                        throw new IllegalArgumentException("bad link '" + target + "' on " + nodeId + "." + port.name());
                    }
                    builder.link(nodeId, port.name(), target.substring(0, dot), target.substring(dot + 1));
                }
            }
            builder.node(node.build());
        }
        return builder.build();
    }

    Port toPort(JsonNode p) {
        final TypeDescriptor type = toType(p.path("type"));
        Port port = new Port(
                required(p, "name"),
                text(p, "display_name"),
                PortDirection.parse(text(p, "direction")),
                type,
                null,
                null
        );
        port = port.withDefaultValue(LiteralRenderer.render(type, p.get("default")));
        final String defaultObject = text(p, "default_object");
        if (defaultObject != null && !defaultObject.isEmpty()) {
            port = port.withDefaultObject(defaultObject);
        }
        return port;
    }

    static TypeDescriptor toType(JsonNode t) {
        if (t.isTextual()) {
            return TypeDescriptor.of(t.asText());
        }
        return new TypeDescriptor(
                text(t, "category"),
                text(t, "sub_category_object"),
                t.path("is_array").asBoolean(false)
        );
    }

    private static String required(JsonNode node, String field) {
        final String v = text(node, field);
        if (v == null) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return v;
    }

    private static String text(JsonNode node, String field) {
        final JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        return v.asText();
    }
}
