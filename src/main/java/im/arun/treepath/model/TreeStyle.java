package im.arun.treepath.model;

import java.util.Locale;

/**
 * Which label an ancestor contributes to a root path, and whether paths are cut
 * at the enclosing expression statement.
 */
public enum TreeStyle {
    /** abstract syntax tree */
    AST(true, false),
    /** simplified parse tree */
    SPT(false, false),
    /** hierarchy syntax tree */
    HST(true, true),
    /** hierarchy parse tree */
    HPT(false, true);

    private final boolean typeLabelled;
    private final boolean hierarchical;

    TreeStyle(boolean typeLabelled, boolean hierarchical) {
        this.typeLabelled = typeLabelled;
        this.hierarchical = hierarchical;
    }

    public boolean isTypeLabelled() {
        return typeLabelled;
    }

    public boolean isHierarchical() {
        return hierarchical;
    }

    public static TreeStyle parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Tree style must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tree style: " + name, e);
        }
    }
}
