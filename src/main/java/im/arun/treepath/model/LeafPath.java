package im.arun.treepath.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.treepath.util.TreeUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Path between two terminals through their lowest common ancestor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeafPath {

    @JsonProperty("source")
    private String source;

    @JsonProperty("middle")
    private String middle;

    @JsonProperty("target")
    private String target;

    /**
     * Number of endpoints (0, 1 or 2) whose value holds more than one sub-token.
     */
    @JsonIgnore
    public int getTier() {
        int tier = 0;
        if (TreeUtils.isMultiToken(source)) {
            tier++;
        }
        if (TreeUtils.isMultiToken(target)) {
            tier++;
        }
        return tier;
    }

    /**
     * {@code source|middle|target}
     */
    public String render() {
        return source + TreeUtils.SEPARATOR + middle + TreeUtils.SEPARATOR + target;
    }

    @JsonIgnore
    public List<String> getTokens() {
        return TreeUtils.splitTokens(render());
    }
}
