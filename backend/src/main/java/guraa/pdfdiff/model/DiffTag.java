package guraa.pdfdiff.model;

/**
 * Classification of a range operation, shared by page alignment and word diffs.
 */
public enum DiffTag {
    EQUAL,
    REPLACE,
    INSERT,
    DELETE
}
