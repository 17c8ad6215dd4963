package im.arun.treepath.parse;

import java.util.List;

/**
 * A node of the tree produced by the external parser.
 * Rows and columns are zero-based; the end point is exclusive.
 */
public interface ParseNode {

    String getKind();

    int getStartRow();

    int getStartColumn();

    int getEndRow();

    int getEndColumn();

    List<? extends ParseNode> getChildren();
}
