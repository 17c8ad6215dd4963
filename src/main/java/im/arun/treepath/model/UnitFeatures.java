package im.arun.treepath.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Every feature extracted from one code unit.
 * {@code coverage} is null for trees too small to measure.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UnitFeatures {

    @JsonProperty("language")
    private String language;

    @JsonProperty("root_path_tokens")
    private List<String> rootPathTokens;

    @JsonProperty("leaf_path_tokens")
    private List<String> leafPathTokens;

    @JsonProperty("sbt_tokens")
    private List<String> sbtTokens;

    @JsonProperty("lcrs_tokens")
    private List<String> lcrsTokens;

    @JsonProperty("coverage")
    private CoverageStats coverage;
}
