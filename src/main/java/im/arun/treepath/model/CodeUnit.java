package im.arun.treepath.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.treepath.parse.JsonParseNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One unit of source code together with the tree the external parser produced for it.
 * Corpus records carry many more fields; only these are read.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CodeUnit {

    @JsonProperty("language")
    private String language;

    @JsonProperty("code")
    @JsonAlias("function")
    private String code;

    @JsonProperty("code_tokens")
    @JsonAlias("function_tokens")
    private List<String> codeTokens;

    @JsonProperty("tree")
    private JsonParseNode tree;
}
