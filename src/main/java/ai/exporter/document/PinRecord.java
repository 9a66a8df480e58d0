package ai.exporter.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A missing default_value means the pin is driven by a wire or by the engine default.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "display_name", "direction", "type", "default_value"})
public record PinRecord(
        @JsonProperty("name") String name,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("direction") String direction,   // "input" | "output"
        @JsonProperty("type") String type,
        @JsonProperty("default_value") String defaultValue
) {
}
