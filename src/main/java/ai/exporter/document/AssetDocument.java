package ai.exporter.document;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Top-level export document of one Blueprint.
 * Field names and nesting are read by downstream tooling; keep them stable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "path", "class_type", "parent_class", "generated_class",
        "graphs", "variables", "functions", "components", "dependencies"})
public record AssetDocument(
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("class_type") String classType,
        @JsonProperty("parent_class") String parentClass,        // omitted when null
        @JsonProperty("generated_class") String generatedClass,  // omitted when null
        @JsonProperty("graphs") List<GraphRecord> graphs,
        @JsonProperty("variables") List<VariableRecord> variables,
        @JsonProperty("functions") List<FunctionRecord> functions,
        @JsonProperty("components") List<ComponentRecord> components,
        @JsonProperty("dependencies") List<String> dependencies
) {

    public static final String CLASS_TYPE = "Blueprint";
}
