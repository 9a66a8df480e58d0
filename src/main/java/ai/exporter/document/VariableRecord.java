package ai.exporter.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "type", "category", "is_exposed", "default_value"})
public record VariableRecord(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("category") String category,
        @JsonProperty("is_exposed") boolean exposed,
        @JsonProperty("default_value") String defaultValue
) {
}
