package ai.exporter.document;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"name", "nodes"})
public record GraphRecord(
        @JsonProperty("name") String name,
        @JsonProperty("nodes") List<NodeRecord> nodes
) {
}
