package im.arun.treepath.tree;

import im.arun.treepath.model.SyntaxTree;
import im.arun.treepath.model.TreeNode;
import im.arun.treepath.normalize.Normalizer;
import im.arun.treepath.parse.MalformedParseTreeException;
import im.arun.treepath.parse.ParseNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Rebuilds the external parser's tree as a {@link TreeNode} graph.
 * The walk is breadth-first over an explicit queue, so deep trees do not grow the stack.
 */
public class TreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    private final Normalizer normalizer;

    public TreeBuilder(Normalizer normalizer) {
        this.normalizer = normalizer;
    }

    public SyntaxTree build(ParseNode parseRoot, String code) {
        return build(parseRoot, Arrays.asList(code.split("\n", -1)));
    }

    /**
     * Rebuild {@code parseRoot} against the source it was parsed from.
     *
     * @param parseRoot root of the parser's tree
     * @param codeLines the source split on '\n'
     * @return root, terminals in level order and the eldest counter
     * @throws MalformedParseTreeException if a node's coordinates do not fit the source
     */
    public SyntaxTree build(ParseNode parseRoot, List<String> codeLines) {
        Deque<BuildItem> queue = new ArrayDeque<>();
        TreeNode root = new TreeNode();
        List<TreeNode> terminals = new ArrayList<>();
        int eldestCounter = 0;
        queue.add(new BuildItem(root, parseRoot));

        while (!queue.isEmpty()) {
            BuildItem item = queue.poll();
            TreeNode node = item.node;
            ParseNode parseNode = item.parseNode;

            if (parseNode.getKind() == null) {
                throw new MalformedParseTreeException("Parse node has no kind");
            }
            node.setLabelType(parseNode.getKind().toLowerCase(Locale.ROOT).trim());
            String token = queryToken(parseNode, codeLines);
            node.appendMark(parseNode.getStartRow(), parseNode.getStartColumn(),
                parseNode.getEndRow(), parseNode.getEndColumn());

            List<? extends ParseNode> parseChildren = parseNode.getChildren();
            if (!parseChildren.isEmpty()) {
                // non-terminal
                eldestCounter++;
                node.setLabelValue(normalizer.desensitize(token));
                TreeNode leftSibling = null;
                for (ParseNode parseChild : parseChildren) {
                    TreeNode child = new TreeNode();
                    node.appendChild(child, leftSibling);
                    leftSibling = child;
                    queue.add(new BuildItem(child, parseChild));
                }
            } else {
                // terminal
                node.setLabelValue(normalizer.formalize(Tokenizer.tokenize(token)));
                terminals.add(node);
            }
        }

        logger.debug("Built tree with {} terminals and {} eldest links", terminals.size(), eldestCounter);
        return new SyntaxTree(root, terminals, eldestCounter);
    }

    /**
     * Source text covered by {@code node}. A node spanning several lines yields the rest
     * of its start line only. Columns past the end of a line are clamped.
     */
    static String queryToken(ParseNode node, List<String> codeLines) {
        int lineStart = node.getStartRow();
        int lineEnd = node.getEndRow();
        int charStart = node.getStartColumn();
        int charEnd = node.getEndColumn();

        if (lineStart < 0 || charStart < 0 || lineEnd < 0 || charEnd < 0) {
            throw malformed(node, "negative coordinate");
        }
        if (lineEnd < lineStart || (lineEnd == lineStart && charEnd < charStart)) {
            throw malformed(node, "end point before start point");
        }
        if (lineEnd >= codeLines.size()) {
            throw malformed(node, "row outside source of " + codeLines.size() + " lines");
        }

        String line = codeLines.get(lineStart);
        int begin = Math.min(charStart, line.length());
        if (lineStart != lineEnd) {
            return line.substring(begin);
        }
        return line.substring(begin, Math.min(charEnd, line.length()));
    }

    private static MalformedParseTreeException malformed(ParseNode node, String reason) {
        return new MalformedParseTreeException(String.format(
            "Malformed parse node '%s' at (%d, %d)-(%d, %d): %s",
            node.getKind(), node.getStartRow(), node.getStartColumn(),
            node.getEndRow(), node.getEndColumn(), reason));
    }

    private static class BuildItem {
        final TreeNode node;
        final ParseNode parseNode;

        BuildItem(TreeNode node, ParseNode parseNode) {
            this.node = node;
            this.parseNode = parseNode;
        }
    }
}
