package guraa.pdfdiff.model;

/**
 * Summary state of one entry in the page comparison output.
 */
public enum PageStatus {
    UNCHANGED,
    SHIFTED,
    CHANGED,
    ADDED,
    MISSING
}
