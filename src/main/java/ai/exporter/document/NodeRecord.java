package ai.exporter.document;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"id", "type", "title", "category", "position", "pins", "connections"})
public record NodeRecord(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,          // kind tag, or the concrete node class for other nodes
        @JsonProperty("title") String title,
        @JsonProperty("category") String category,  // "" when the node has no menu category
        @JsonProperty("position") Position position,
        @JsonProperty("pins") List<PinRecord> pins,
        @JsonProperty("connections") List<String> connections // downstream node ids, first-seen order
) {

    @JsonPropertyOrder({"x", "y"})
    public record Position(
            @JsonProperty("x") int x,
            @JsonProperty("y") int y
    ) {
    }
}
