package im.arun.treepath.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How much of a tree's structure and vocabulary the sampled paths cover.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CoverageStats {

    @JsonProperty("link_coverage_rootpath")
    private double linkCoverageRootPath;

    @JsonProperty("link_coverage_leafpath")
    private double linkCoverageLeafPath;

    @JsonProperty("link_coverage_lcrs")
    private double linkCoverageLcrs;

    @JsonProperty("node_coverage_rootpath")
    private double nodeCoverageRootPath;

    @JsonProperty("node_coverage_leafpath")
    private double nodeCoverageLeafPath;
}
