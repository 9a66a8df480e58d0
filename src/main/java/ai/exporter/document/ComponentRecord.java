package ai.exporter.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"name", "class"})
public record ComponentRecord(
        @JsonProperty("name") String name,
        @JsonProperty("class") String className
) {
}
