package im.arun.treepath.path;

import im.arun.treepath.config.TreePathConfig;
import im.arun.treepath.model.LeafPath;
import im.arun.treepath.model.MergedPath;
import im.arun.treepath.model.PathStyle;
import im.arun.treepath.model.RootPath;
import im.arun.treepath.model.SyntaxTree;
import im.arun.treepath.model.TreeNode;
import im.arun.treepath.model.TreeStyle;
import im.arun.treepath.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Derives root paths (ancestor chains of single terminals) and leaf paths (pairs of
 * root paths joined at their lowest common ancestor), both under a sampling quota
 * that prefers identifiers made of several sub-tokens.
 */
public class PathExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PathExtractor.class);

    static final String IDENTIFIER = "identifier";
    static final String EXPRESSION_STATEMENT = "expression_statement";

    private final TreePathConfig config;
    private final QuotaSampler sampler;

    public PathExtractor(TreePathConfig config, QuotaSampler sampler) {
        this.config = config;
        this.sampler = sampler;
    }

    /**
     * Root path of a single terminal under the configured tree style.
     * Labels run root first and carry the mark of the ancestor they name; the anchor
     * carries the terminal's own mark.
     */
    public RootPath rootPathOf(TreeNode terminal) {
        TreeStyle treeStyle = config.getTreeStyle();
        List<String> labels = new ArrayList<>();
        TreeNode statement = null;

        TreeNode ptr = terminal;
        while (ptr.getParent() != null) {
            ptr = ptr.getParent();
            String label = treeStyle.isTypeLabelled() ? ptr.getLabelType() : ptr.getLabelValue();
            labels.add(label + ptr.getMark());
            if (treeStyle.isHierarchical() && statement == null
                    && EXPRESSION_STATEMENT.equals(ptr.getLabelType())) {
                // keep only what lies above the statement
                statement = ptr;
                labels.clear();
            }
        }
        Collections.reverse(labels);

        String value = statement != null ? statementValue(statement) : terminal.getLabelValue();
        return new RootPath(labels, value + terminal.getMark());
    }

    /**
     * Sub-tokens of every identifier terminal under {@code statement}, in level order.
     */
    private String statementValue(TreeNode statement) {
        List<String> values = new ArrayList<>();
        Deque<TreeNode> queue = new ArrayDeque<>();
        queue.add(statement);
        while (!queue.isEmpty()) {
            TreeNode node = queue.poll();
            if (node.isTerminal() && IDENTIFIER.equals(node.getLabelType())) {
                values.addAll(TreeUtils.splitTokens(node.getLabelValue()));
            }
            queue.addAll(node.getChildren());
        }
        return String.join(TreeUtils.SEPARATOR, values);
    }

    /**
     * Sample up to {@code rootPathThreshold} identifier root paths, multi-token anchors first.
     * Every terminal's path is recorded in {@code session} whether sampled or not.
     */
    public List<RootPath> generateRootPaths(SyntaxTree tree, ExtractionSession session) {
        List<RootPath> multiToken = new ArrayList<>();
        List<RootPath> singleToken = new ArrayList<>();

        for (TreeNode terminal : tree.getTerminals()) {
            RootPath rootPath = rootPathOf(terminal);
            session.getTerminalNodes().add(rootPath.getAnchor());
            session.getNonterminalNodes().addAll(rootPath.getLabels());

            if (IDENTIFIER.equals(terminal.getLabelType()) && !rootPath.getLabels().isEmpty()) {
                if (rootPath.isMultiToken()) {
                    multiToken.add(rootPath);
                } else {
                    singleToken.add(rootPath);
                }
            }
        }

        List<RootPath> rootPaths = sampler.selectWithQuota(config.getRootPathThreshold(), multiToken, singleToken);
        logger.debug("Selected {} root paths ({} multi-token, {} single-token candidates)",
            rootPaths.size(), multiToken.size(), singleToken.size());

        for (RootPath rootPath : rootPaths) {
            session.getRootPathTerminalNodes().add(rootPath.getAnchor());
            session.getRootPathNonterminalNodes().addAll(rootPath.getLabels());
        }
        return rootPaths;
    }

    /**
     * Sample root paths, then pair them into leaf paths.
     */
    public List<LeafPath> generateLeafPaths(SyntaxTree tree, ExtractionSession session) {
        return generateLeafPaths(generateRootPaths(tree, session), session);
    }

    /**
     * Pair every two root paths (in order) into a leaf path, keeping pairs whose two
     * halves are non-empty, balanced within {@code pathWidthThreshold} and no longer
     * than {@code pathLengthThreshold} hops, then sample up to {@code leafPathThreshold}
     * paths preferring endpoints with several sub-tokens.
     */
    public List<LeafPath> generateLeafPaths(List<RootPath> rootPaths, ExtractionSession session) {
        List<List<LeafPath>> tiers = pairByTier(rootPaths);
        List<LeafPath> leafPaths = sampler.selectWithQuota(config.getLeafPathThreshold(),
            tiers.get(0), tiers.get(1), tiers.get(2));
        logger.debug("Selected {} leaf paths from tiers of {}/{}/{}",
            leafPaths.size(), tiers.get(0).size(), tiers.get(1).size(), tiers.get(2).size());

        for (LeafPath leafPath : leafPaths) {
            // values may hold separators themselves, so only the outermost pieces count as endpoints
            List<String> tokens = leafPath.getTokens();
            session.getLeafPathTerminalNodes().add(tokens.get(0));
            session.getLeafPathTerminalNodes().add(tokens.get(tokens.size() - 1));
            session.getLeafPathNonterminalNodes().addAll(tokens.subList(1, tokens.size() - 1));
        }
        return leafPaths;
    }

    /**
     * Qualifying leaf paths bucketed by tier, two multi-token endpoints first.
     * Once the better tiers alone can fill the quota, pairs that could only land in a
     * worse tier are skipped before they are merged.
     */
    List<List<LeafPath>> pairByTier(List<RootPath> rootPaths) {
        int threshold = config.getLeafPathThreshold();
        List<LeafPath> leafPaths2 = new ArrayList<>();
        List<LeafPath> leafPaths1 = new ArrayList<>();
        List<LeafPath> leafPaths0 = new ArrayList<>();

        for (int i = 0; i < rootPaths.size(); i++) {
            RootPath u = rootPaths.get(i);
            for (int j = i + 1; j < rootPaths.size(); j++) {
                RootPath v = rootPaths.get(j);

                // stop collecting tiers that can no longer be picked
                if (threshold <= leafPaths2.size()) {
                    if (!u.isMultiToken() || !v.isMultiToken()) {
                        continue;
                    }
                } else if (threshold <= leafPaths2.size() + leafPaths1.size()) {
                    if (!u.isMultiToken() && !v.isMultiToken()) {
                        continue;
                    }
                }

                MergedPath merged = TreeUtils.mergePaths(u.getLabels(), v.getLabels());
                if (!qualifies(merged)) {
                    continue;
                }

                LeafPath leafPath = new LeafPath(u.getAnchor(), renderMiddle(merged), v.getAnchor());
                switch (leafPath.getTier()) {
                    case 2:
                        leafPaths2.add(leafPath);
                        break;
                    case 1:
                        leafPaths1.add(leafPath);
                        break;
                    default:
                        leafPaths0.add(leafPath);
                }
            }
        }
        return List.of(leafPaths2, leafPaths1, leafPaths0);
    }

    boolean qualifies(MergedPath merged) {
        int prefixLen = merged.getPrefix().size();
        int suffixLen = merged.getSuffix().size();
        return prefixLen >= 1 && suffixLen >= 1
            && Math.abs(prefixLen - suffixLen) <= config.getPathWidthThreshold()
            && prefixLen + 1 + suffixLen <= config.getPathLengthThreshold();
    }

    String renderMiddle(MergedPath merged) {
        List<String> prefix = merged.getPrefix();
        List<String> suffix = merged.getSuffix();
        PathStyle pathStyle = config.getPathStyle();

        if (pathStyle == PathStyle.L2L) {
            List<String> hops = new ArrayList<>(prefix);
            hops.add(merged.getLca());
            hops.addAll(suffix);
            return String.join(TreeUtils.SEPARATOR, hops);
        }
        if (pathStyle == PathStyle.UD) {
            List<String> moves = new ArrayList<>();
            moves.addAll(Collections.nCopies(prefix.size(), "U"));
            moves.addAll(Collections.nCopies(suffix.size(), "D"));
            return String.join(TreeUtils.SEPARATOR, moves);
        }
        return String.join("|U|", prefix) + "|U|" + merged.getLca() + "|D|" + String.join("|D|", suffix);
    }
}
