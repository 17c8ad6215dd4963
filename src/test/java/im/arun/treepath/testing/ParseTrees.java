package im.arun.treepath.testing;

import im.arun.treepath.model.CodeUnit;
import im.arun.treepath.parse.JsonParseNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Hand-written parser output for tests, shaped like tree-sitter's Python trees.
 */
public final class ParseTrees {

    /**
     * Two statements. Level-order terminals are
     * {@code x, =, print, getValue, (, x, ), (, my_name, )}.
     */
    public static final String ASSIGNMENT_CODE = "x = getValue(my_name)\nprint(x)";

    private ParseTrees() {}

    public static JsonParseNode node(String type, int startRow, int startColumn, int endRow, int endColumn,
                                     JsonParseNode... children) {
        return new JsonParseNode(type, List.of(startRow, startColumn), List.of(endRow, endColumn),
            new ArrayList<>(Arrays.asList(children)));
    }

    public static JsonParseNode assignmentTree() {
        return node("module", 0, 0, 1, 8,
            node("expression_statement", 0, 0, 0, 21,
                node("assignment", 0, 0, 0, 21,
                    node("identifier", 0, 0, 0, 1),
                    node("=", 0, 2, 0, 3),
                    node("call", 0, 4, 0, 21,
                        node("identifier", 0, 4, 0, 12),
                        node("argument_list", 0, 12, 0, 21,
                            node("(", 0, 12, 0, 13),
                            node("identifier", 0, 13, 0, 20),
                            node(")", 0, 20, 0, 21))))),
            node("expression_statement", 1, 0, 1, 8,
                node("call", 1, 0, 1, 8,
                    node("identifier", 1, 0, 1, 5),
                    node("argument_list", 1, 5, 1, 8,
                        node("(", 1, 5, 1, 6),
                        node("identifier", 1, 6, 1, 7),
                        node(")", 1, 7, 1, 8)))));
    }

    public static CodeUnit assignmentUnit() {
        return unit(ASSIGNMENT_CODE, assignmentTree());
    }

    /**
     * A module whose children are identifier terminals, one per space-separated word.
     */
    public static JsonParseNode flatTree(String code) {
        String[] words = code.split(" ");
        JsonParseNode[] children = new JsonParseNode[words.length];
        int column = 0;
        for (int i = 0; i < words.length; i++) {
            children[i] = node("identifier", 0, column, 0, column + words[i].length());
            column += words[i].length() + 1;
        }
        return node("module", 0, 0, 0, code.length(), children);
    }

    /**
     * A module of one-identifier expression statements, one per space-separated word.
     */
    public static JsonParseNode statements(String code) {
        String[] words = code.split(" ");
        JsonParseNode[] children = new JsonParseNode[words.length];
        int column = 0;
        for (int i = 0; i < words.length; i++) {
            int end = column + words[i].length();
            children[i] = node("expression_statement", 0, column, 0, end,
                node("identifier", 0, column, 0, end));
            column = end + 1;
        }
        return node("module", 0, 0, 0, code.length(), children);
    }

    /**
     * {@code depth} nested nodes over the one-character source "x", each with a single child.
     */
    public static JsonParseNode chain(int depth) {
        JsonParseNode current = node("identifier", 0, 0, 0, 1);
        for (int i = 1; i < depth; i++) {
            current = node("parenthesized_expression", 0, 0, 0, 1, current);
        }
        return current;
    }

    public static CodeUnit unit(String code, JsonParseNode tree) {
        return new CodeUnit("python", code, null, tree);
    }
}
