package im.arun.treepath.stats;

import im.arun.treepath.model.CoverageStats;
import im.arun.treepath.path.ExtractionSession;
import im.arun.treepath.util.TreeUtils;

import java.util.Collection;
import java.util.HashSet;

/**
 * Compares the labels reached by sampled paths with the labels of the whole tree.
 * <p>
 * Link coverage keeps position marks, so every occurrence counts:
 * {@code (pathTerminals + pathNonterminals - 1) / (terminals + nonterminals - 1)}.
 * Node coverage strips the marks first and counts vocabulary:
 * {@code (pathTerminals + pathNonterminals) / (terminals + nonterminals)}.
 * Terminal and non-terminal sets are sized separately and summed, not unioned.
 */
public class CoverageAnalyzer {

    /**
     * @param session     accumulators filled by root-path and leaf-path generation
     * @param eldestCount number of eldest links in the tree's binary view
     * @throws DegenerateTreeException if the tree has at most one distinct label
     */
    public CoverageStats analyze(ExtractionSession session, int eldestCount) {
        int numTerminalNodes = distinct(session.getTerminalNodes());
        int numNonterminalNodes = distinct(session.getNonterminalNodes());
        int linkDenominator = numTerminalNodes + numNonterminalNodes - 1;
        if (linkDenominator <= 0) {
            throw new DegenerateTreeException(String.format(
                "Cannot compute coverage over %d terminal and %d non-terminal labels",
                numTerminalNodes, numNonterminalNodes));
        }

        double linkCoverageRootPath = (double) (distinct(session.getRootPathTerminalNodes())
            + distinct(session.getRootPathNonterminalNodes()) - 1) / linkDenominator;
        double linkCoverageLeafPath = (double) (distinct(session.getLeafPathTerminalNodes())
            + distinct(session.getLeafPathNonterminalNodes()) - 1) / linkDenominator;
        double linkCoverageLcrs = (double) eldestCount / linkDenominator;

        int nodeDenominator = distinctUnmarked(session.getTerminalNodes())
            + distinctUnmarked(session.getNonterminalNodes());
        double nodeCoverageRootPath = (double) (distinctUnmarked(session.getRootPathTerminalNodes())
            + distinctUnmarked(session.getRootPathNonterminalNodes())) / nodeDenominator;
        double nodeCoverageLeafPath = (double) (distinctUnmarked(session.getLeafPathTerminalNodes())
            + distinctUnmarked(session.getLeafPathNonterminalNodes())) / nodeDenominator;

        return new CoverageStats(linkCoverageRootPath, linkCoverageLeafPath, linkCoverageLcrs,
            nodeCoverageRootPath, nodeCoverageLeafPath);
    }

    private static int distinct(Collection<String> labels) {
        return new HashSet<>(labels).size();
    }

    private static int distinctUnmarked(Collection<String> labels) {
        return new HashSet<>(TreeUtils.stripMarks(labels)).size();
    }
}
