package im.arun.treepath.util;

import im.arun.treepath.model.MergedPath;
import im.arun.treepath.model.TreeNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Utility methods for path labels, token splitting and path merging.
 */
public class TreeUtils {

    /** Divides sub-tokens inside a value and tokens inside a rendered path. */
    public static final String SEPARATOR = "|";

    private static final Pattern SEPARATOR_PATTERN = Pattern.compile(Pattern.quote(SEPARATOR));
    private static final Pattern BRACKET_PATTERN = Pattern.compile("[(|)]");

    private TreeUtils() {
    }

    /**
     * Split on the separator, keeping empty pieces.
     * e.g., "get|name" -> [get, name], "x" -> [x]
     */
    public static List<String> splitTokens(String value) {
        return Arrays.asList(SEPARATOR_PATTERN.split(value, -1));
    }

    public static boolean isMultiToken(String value) {
        return value != null && value.contains(SEPARATOR);
    }

    /**
     * Split a bracketed serialization on '(', '|' and ')' and drop the empty pieces.
     */
    public static List<String> splitBracketTokens(String representation) {
        List<String> tokens = new ArrayList<>();
        for (String piece : BRACKET_PATTERN.split(representation)) {
            if (!piece.isEmpty()) {
                tokens.add(piece);
            }
        }
        return tokens;
    }

    /**
     * Remove the position mark from a label.
     * e.g., "identifier@1~4~1~7" -> "identifier"
     */
    public static String stripMark(String label) {
        int index = label.indexOf(TreeNode.MARK_DELIMITER);
        return index < 0 ? label : label.substring(0, index);
    }

    public static List<String> stripMarks(Collection<String> labels) {
        List<String> stripped = new ArrayList<>(labels.size());
        for (String label : labels) {
            stripped.add(stripMark(label));
        }
        return stripped;
    }

    /**
     * Join two root-path label sequences at their lowest common ancestor.
     * e.g., [a, b, c] and [a, b, d] -> prefix [c], lca b, suffix [d]
     *
     * @throws IllegalArgumentException if the paths share no leading label
     */
    public static MergedPath mergePaths(List<String> uPath, List<String> vPath) {
        int shared = 0;
        int limit = Math.min(uPath.size(), vPath.size());
        while (shared < limit && uPath.get(shared).equals(vPath.get(shared))) {
            shared++;
        }

        if (shared == 0) {
            throw new IllegalArgumentException("Root paths share no common ancestor: " + uPath + " / " + vPath);
        }

        List<String> prefix = new ArrayList<>(uPath.subList(shared, uPath.size()));
        Collections.reverse(prefix);
        String lca = uPath.get(shared - 1);
        List<String> suffix = new ArrayList<>(vPath.subList(shared, vPath.size()));

        return new MergedPath(prefix, lca, suffix);
    }
}
