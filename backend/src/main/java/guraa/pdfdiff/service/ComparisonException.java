package guraa.pdfdiff.service;

/**
 * Thrown when a comparison cannot be run, typically because a document could not be
 * opened or read.
 */
public class ComparisonException extends RuntimeException {

    public ComparisonException(String message, Throwable cause) {
        super(message, cause);
    }
}
