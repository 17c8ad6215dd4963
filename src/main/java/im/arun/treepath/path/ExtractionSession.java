package im.arun.treepath.path;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Labels collected while paths are extracted from one code unit, later compared by
 * {@link im.arun.treepath.stats.CoverageAnalyzer}. Create one per unit; never reuse.
 */
@Getter
public class ExtractionSession {

    // every terminal and every root-path label of the whole tree
    private final List<String> terminalNodes = new ArrayList<>();
    private final List<String> nonterminalNodes = new ArrayList<>();

    // sampled root paths
    private final List<String> rootPathTerminalNodes = new ArrayList<>();
    private final List<String> rootPathNonterminalNodes = new ArrayList<>();

    // sampled leaf paths
    private final List<String> leafPathTerminalNodes = new ArrayList<>();
    private final List<String> leafPathNonterminalNodes = new ArrayList<>();
}
