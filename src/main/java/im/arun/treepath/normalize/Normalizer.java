package im.arun.treepath.normalize;

/**
 * Text normalization applied while the tree is rebuilt.
 * Implementations must be deterministic, accept any string and never introduce the
 * token separator {@code |} inside a sub-token.
 */
public interface Normalizer {

    /**
     * Normalize the synthesized value of a non-terminal.
     */
    String desensitize(String value);

    /**
     * Normalize the tokenized value of a terminal.
     */
    String formalize(String value);
}
