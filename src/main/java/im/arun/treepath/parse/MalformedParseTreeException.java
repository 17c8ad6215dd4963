package im.arun.treepath.parse;

/**
 * Raised when parser output breaks its contract, e.g. a node whose end point lies
 * before its start point or whose row is outside the source.
 */
public class MalformedParseTreeException extends RuntimeException {

    public MalformedParseTreeException(String message) {
        super(message);
    }

    public MalformedParseTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
