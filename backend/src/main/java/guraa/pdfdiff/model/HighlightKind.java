package guraa.pdfdiff.model;

/**
 * Kind of a highlighted word region.
 */
public enum HighlightKind {
    /** Word present only in document B. */
    ADDED,
    /** Word present only in document A. */
    REMOVED
}
