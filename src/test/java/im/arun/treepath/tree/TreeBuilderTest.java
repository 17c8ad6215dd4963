package im.arun.treepath.tree;

import static im.arun.treepath.testing.ParseTrees.node;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import im.arun.treepath.model.SyntaxTree;
import im.arun.treepath.model.TreeNode;
import im.arun.treepath.normalize.Normalizer;
import im.arun.treepath.normalize.PassThroughNormalizer;
import im.arun.treepath.parse.JsonParseNode;
import im.arun.treepath.parse.MalformedParseTreeException;
import im.arun.treepath.testing.ParseTrees;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

final class TreeBuilderTest {

    private final TreeBuilder builder = new TreeBuilder(new PassThroughNormalizer());

    @Test
    void collectsTerminalsInLevelOrder() {
        SyntaxTree tree = builder.build(ParseTrees.assignmentTree(), ParseTrees.ASSIGNMENT_CODE);

        List<String> values = tree.getTerminals().stream()
            .map(TreeNode::getLabelValue)
            .collect(Collectors.toList());
        assertEquals(List.of("x", "=", "print", "get|value", "(", "x", ")", "(", "my|name", ")"), values);
        assertEquals(8, tree.getEldestCount(), "one eldest link per non-terminal");
    }

    @Test
    void labelsCarryTypeValueAndMark() {
        SyntaxTree tree = builder.build(ParseTrees.assignmentTree(), ParseTrees.ASSIGNMENT_CODE);
        TreeNode root = tree.getRoot();

        assertEquals("module", root.getLabelType());
        assertEquals("@0~0~1~8", root.getMark());
        // a multi-line node keeps the rest of its first line only
        assertEquals("x = getValue(my_name)", root.getLabelValue());

        TreeNode getValue = tree.getTerminals().get(3);
        assertEquals("identifier", getValue.getLabelType());
        assertEquals("@0~4~0~12", getValue.getMark());
    }

    @Test
    void wiresBothTreeForms() {
        SyntaxTree tree = builder.build(ParseTrees.assignmentTree(), ParseTrees.ASSIGNMENT_CODE);
        TreeNode assignment = tree.getRoot().getChildren().get(0).getChildren().get(0);
        List<TreeNode> children = assignment.getChildren();

        assertEquals(3, children.size());
        assertSame(children.get(0), assignment.getLeftChild());
        assertTrue(children.get(0).isEldest());
        assertFalse(children.get(1).isEldest());
        assertSame(assignment, children.get(0).getGuardian());
        assertSame(children.get(0), children.get(1).getGuardian());
        assertSame(children.get(1), children.get(0).getRightSibling());
        assertSame(children.get(2), children.get(1).getRightSibling());
        assertNull(children.get(2).getRightSibling());
        for (TreeNode child : children) {
            assertSame(assignment, child.getParent());
        }

        TreeNode terminal = children.get(0);
        assertTrue(terminal.isTerminal());
        assertNull(terminal.getLeftChild());
    }

    @Test
    void childrenCannotBeAddedBehindTheBuildersBack() {
        SyntaxTree tree = builder.build(ParseTrees.assignmentTree(), ParseTrees.ASSIGNMENT_CODE);
        List<TreeNode> children = tree.getRoot().getChildren();

        assertThrows(UnsupportedOperationException.class, () -> children.add(new TreeNode()));
        assertThrows(UnsupportedOperationException.class, () -> children.remove(0));
        assertEquals(2, tree.getRoot().getChildren().size());
    }

    @Test
    void appliesNormalizerPerNodeKind() {
        Normalizer upper = new Normalizer() {
            @Override
            public String desensitize(String value) {
                return "<stmt>";
            }

            @Override
            public String formalize(String value) {
                return value.toUpperCase();
            }
        };
        SyntaxTree tree = new TreeBuilder(upper).build(ParseTrees.flatTree("fooBar baz"), "fooBar baz");

        assertEquals("<stmt>", tree.getRoot().getLabelValue());
        assertEquals("FOO|BAR", tree.getTerminals().get(0).getLabelValue());
        assertEquals("BAZ", tree.getTerminals().get(1).getLabelValue());
    }

    @Test
    void singleNodeTreeIsItsOwnTerminal() {
        SyntaxTree tree = builder.build(node("module", 0, 0, 0, 0), "");

        assertEquals(0, tree.getEldestCount());
        assertEquals(List.of(tree.getRoot()), tree.getTerminals());
        assertEquals("", tree.getRoot().getLabelValue());
    }

    @Test
    void queryTokenClampsColumnsLikeASlice() {
        List<String> lines = List.of("def foo():", "  pass");

        assertEquals("foo", TreeBuilder.queryToken(node("identifier", 0, 4, 0, 7), lines));
        assertEquals("foo():", TreeBuilder.queryToken(node("function_definition", 0, 4, 1, 6), lines));
        assertEquals("():", TreeBuilder.queryToken(node("parameters", 0, 7, 0, 40), lines));
        assertEquals("", TreeBuilder.queryToken(node("comment", 0, 40, 0, 42), lines));
    }

    @Test
    void rejectsEndBeforeStart() {
        JsonParseNode broken = node("module", 0, 0, 0, 5, node("identifier", 0, 3, 0, 1));

        MalformedParseTreeException e =
            assertThrows(MalformedParseTreeException.class, () -> builder.build(broken, "hello"));
        assertTrue(e.getMessage().contains("identifier"));
    }

    @Test
    void rejectsRowOutsideSource() {
        JsonParseNode broken = node("module", 0, 0, 3, 0);

        assertThrows(MalformedParseTreeException.class, () -> builder.build(broken, "one line"));
    }

    @Test
    void rejectsNodeWithoutPoints() {
        JsonParseNode broken = new JsonParseNode("module", null, List.of(0, 1), null);

        assertThrows(MalformedParseTreeException.class, () -> builder.build(broken, "x"));
    }
}
