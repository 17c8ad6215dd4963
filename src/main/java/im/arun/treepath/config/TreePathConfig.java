package im.arun.treepath.config;

import im.arun.treepath.model.PathStyle;
import im.arun.treepath.model.TreeStyle;
import lombok.Data;

@Data
public class TreePathConfig {
    private TreeStyle treeStyle = TreeStyle.SPT;
    private PathStyle pathStyle = PathStyle.L2L;
    private int rootPathThreshold = 20;
    private int leafPathThreshold = 20;
    private int pathWidthThreshold = 2;
    private int pathLengthThreshold = 8;
    private int lcrsDepthLimit = 1000;
    // null: unseeded sampling
    private Long seed;
}
