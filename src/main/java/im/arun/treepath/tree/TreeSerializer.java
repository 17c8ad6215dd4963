package im.arun.treepath.tree;

import im.arun.treepath.model.TreeNode;
import im.arun.treepath.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Linear token forms of a whole tree.
 * <ul>
 *   <li>SBT: structure-based traversal of the multi-way tree, {@code value(children)value}</li>
 *   <li>LC-RS: in-order walk of the binary view, {@code (left(value)right)}</li>
 * </ul>
 * Node values are rendered instead of types.
 */
public class TreeSerializer {
    private static final Logger logger = LoggerFactory.getLogger(TreeSerializer.class);

    private final int lcrsDepthLimit;

    public TreeSerializer(int lcrsDepthLimit) {
        this.lcrsDepthLimit = lcrsDepthLimit;
    }

    public List<String> sbtTokens(TreeNode root) {
        return TreeUtils.splitBracketTokens(renderSbt(root));
    }

    /**
     * LC-RS tokens, or the SBT tokens when the binary view is deeper than the limit.
     */
    public List<String> lcrsTokens(TreeNode root) {
        try {
            StringBuilder out = new StringBuilder();
            renderLcrs(root, 1, out);
            return TreeUtils.splitBracketTokens(out.toString());
        } catch (DepthLimitExceededException | StackOverflowError e) {
            // the right-sibling chain of a wide node makes the binary view very deep
            logger.warn("LC-RS rendering exceeded depth limit {}, falling back to SBT", lcrsDepthLimit);
            return sbtTokens(root);
        }
    }

    public String renderSbt(TreeNode root) {
        StringBuilder out = new StringBuilder();
        renderSbt(root, out);
        return out.toString();
    }

    private void renderSbt(TreeNode node, StringBuilder out) {
        out.append(node.getLabelValue()).append('(');
        for (TreeNode child : node.getChildren()) {
            renderSbt(child, out);
        }
        out.append(')').append(node.getLabelValue());
    }

    private void renderLcrs(TreeNode node, int depth, StringBuilder out) {
        if (depth > lcrsDepthLimit) {
            throw new DepthLimitExceededException();
        }
        out.append('(');
        if (node.getLeftChild() != null) {
            renderLcrs(node.getLeftChild(), depth + 1, out);
        }
        out.append('(').append(node.getLabelValue()).append(')');
        if (node.getRightSibling() != null) {
            renderLcrs(node.getRightSibling(), depth + 1, out);
        }
        out.append(')');
    }

    private static class DepthLimitExceededException extends RuntimeException {
        DepthLimitExceededException() {
            super(null, null, false, false);
        }
    }
}
