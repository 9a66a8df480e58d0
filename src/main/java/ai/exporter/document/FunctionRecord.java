package ai.exporter.document;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Signature view (parameters) plus graph view of one function graph.
 */
@JsonPropertyOrder({"name", "parameters", "graph"})
public record FunctionRecord(
        @JsonProperty("name") String name,
        @JsonProperty("parameters") List<Parameter> parameters,
        @JsonProperty("graph") GraphRecord graph
) {

    @JsonPropertyOrder({"name", "type"})
    public record Parameter(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type
    ) {
    }
}
