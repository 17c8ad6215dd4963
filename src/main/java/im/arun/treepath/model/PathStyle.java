package im.arun.treepath.model;

import java.util.Locale;

/**
 * Rendering of the middle segment of a leaf path.
 */
public enum PathStyle {
    /** labels of every hop plus the LCA */
    L2L,
    /** one U per upward hop, one D per downward hop */
    UD,
    /** labels interleaved with U / D markers */
    U2D;

    public static PathStyle parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Path style must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown path style: " + name, e);
        }
    }
}
