package im.arun.treepath.parse;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parse node as dumped by tree-sitter style tooling:
 * <pre>{"type": "identifier", "start_point": [0, 4], "end_point": [0, 7], "children": []}</pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonParseNode implements ParseNode {

    @JsonProperty("type")
    private String type;

    @JsonProperty("start_point")
    private List<Integer> startPoint;

    @JsonProperty("end_point")
    private List<Integer> endPoint;

    @JsonProperty("children")
    private List<JsonParseNode> children = new ArrayList<>();

    @Override
    @JsonIgnore
    public String getKind() {
        return type;
    }

    @Override
    @JsonIgnore
    public int getStartRow() {
        return coordinate(startPoint, 0, "start_point");
    }

    @Override
    @JsonIgnore
    public int getStartColumn() {
        return coordinate(startPoint, 1, "start_point");
    }

    @Override
    @JsonIgnore
    public int getEndRow() {
        return coordinate(endPoint, 0, "end_point");
    }

    @Override
    @JsonIgnore
    public int getEndColumn() {
        return coordinate(endPoint, 1, "end_point");
    }

    @Override
    public List<JsonParseNode> getChildren() {
        return children != null ? children : List.of();
    }

    private int coordinate(List<Integer> point, int index, String field) {
        if (point == null || point.size() != 2 || point.get(index) == null) {
            throw new MalformedParseTreeException(
                String.format("Node '%s' has invalid %s: %s", type, field, point));
        }
        return point.get(index);
    }
}
