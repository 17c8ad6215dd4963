package im.arun.treepath.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the rebuilt syntax tree.
 * Every node takes part in two forms at once: the multi-way tree (parent / children)
 * and the left-child right-sibling binary view (guardian / leftChild / rightSibling).
 * Only {@code children} owns nodes; the other links are back-references, so no
 * generated equals/hashCode/toString may walk them.
 */
@Getter
@Setter
@NoArgsConstructor
public class TreeNode {

    /** Delimiter that prefixes every position mark. */
    public static final String MARK_DELIMITER = "@";

    private String labelType;

    private String labelValue;

    // "@1~4~1~7" for start point (1, 4) and end point (1, 7)
    private String mark = MARK_DELIMITER;

    // first child under its parent
    private boolean eldest;

    // LC-RS view
    private TreeNode guardian;
    private TreeNode leftChild;
    private TreeNode rightSibling;

    // multi-way view
    private TreeNode parent;
    private final List<TreeNode> children = new ArrayList<>();

    /**
     * Attach {@code child} as the last child, wiring both tree forms.
     *
     * @param child       the new child
     * @param leftSibling the current last child, or null if {@code child} is the eldest
     */
    public void appendChild(TreeNode child, TreeNode leftSibling) {
        if (leftSibling != null) {
            child.guardian = leftSibling;
            leftSibling.rightSibling = child;
        } else {
            child.guardian = this;
            child.eldest = true;
            this.leftChild = child;
        }
        child.parent = this;
        children.add(child);
    }

    /**
     * Read-only view of the children; {@link #appendChild} is the only way to add one.
     */
    public List<TreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isTerminal() {
        return children.isEmpty();
    }

    public void appendMark(int startRow, int startColumn, int endRow, int endColumn) {
        mark += startRow + "~" + startColumn + "~" + endRow + "~" + endColumn;
    }

    @Override
    public String toString() {
        return "TreeNode(" + labelType + ", " + labelValue + mark + ", children=" + children.size() + ")";
    }
}
