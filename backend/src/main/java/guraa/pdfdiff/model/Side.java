package guraa.pdfdiff.model;

/**
 * Which of the two compared documents something belongs to.
 * A is the original document, B the modified one.
 */
public enum Side {
    A,
    B;

    public Side opposite() {
        return this == A ? B : A;
    }
}
