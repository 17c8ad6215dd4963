package im.arun.treepath.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Result of rebuilding one parse tree: the root, the terminals in breadth-first
 * discovery order and the number of nodes that own an eldest child.
 */
@Getter
@AllArgsConstructor
public class SyntaxTree {

    private final TreeNode root;

    private final List<TreeNode> terminals;

    private final int eldestCount;
}
