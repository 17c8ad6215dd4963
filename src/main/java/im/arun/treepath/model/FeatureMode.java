package im.arun.treepath.model;

import java.util.Locale;

/**
 * Token feature produced for a code unit.
 */
public enum FeatureMode {
    /** the corpus's own code tokens */
    CODE,
    ROOTPATH,
    LEAFPATH,
    SBT,
    LCRS;

    public static FeatureMode parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Feature mode must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown feature mode: " + name, e);
        }
    }
}
