package im.arun.treepath.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.treepath.util.TreeUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ancestor labels from the root down to a terminal's parent, paired with the
 * terminal's anchor value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RootPath {

    @JsonProperty("labels")
    private List<String> labels;

    @JsonProperty("anchor")
    private String anchor;

    /**
     * Anchor split on the token separator.
     */
    @JsonIgnore
    public List<String> getAnchorTokens() {
        return TreeUtils.splitTokens(anchor);
    }

    /**
     * True when the anchor holds more than one sub-token.
     */
    @JsonIgnore
    public boolean isMultiToken() {
        return TreeUtils.isMultiToken(anchor);
    }
}
