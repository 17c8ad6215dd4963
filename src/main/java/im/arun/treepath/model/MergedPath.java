package im.arun.treepath.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Two root paths joined at their lowest common ancestor.
 * {@code prefix} runs from the source side up towards the LCA, {@code suffix}
 * from the LCA down towards the target.
 */
@Data
@AllArgsConstructor
public class MergedPath {

    private List<String> prefix;

    private String lca;

    private List<String> suffix;
}
