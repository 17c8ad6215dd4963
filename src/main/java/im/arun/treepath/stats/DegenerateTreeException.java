package im.arun.treepath.stats;

/**
 * Raised when a tree has too few distinct labels for coverage ratios to be defined.
 */
public class DegenerateTreeException extends RuntimeException {

    public DegenerateTreeException(String message) {
        super(message);
    }
}
