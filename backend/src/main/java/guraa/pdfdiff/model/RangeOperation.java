package guraa.pdfdiff.model;

import java.util.List;

/**
 * A tagged pair of half-open ranges {@code [aStart, aEnd)} and {@code [bStart, bEnd)}
 * over two sequences.
 */
public interface RangeOperation {

    DiffTag getTag();

    int getAStart();

    int getAEnd();

    int getBStart();

    int getBEnd();

    default int aLength() {
        return getAEnd() - getAStart();
    }

    default int bLength() {
        return getBEnd() - getBStart();
    }

    /**
     * Checks that the a-ranges of {@code operations} tile {@code [0, lengthA)} and the
     * b-ranges tile {@code [0, lengthB)}, in order and without gaps or overlap, and that
     * each operation's tag agrees with which of its ranges are empty.
     *
     * @throws IllegalStateException if the operations break the invariant
     */
    static void verifyCoverage(List<? extends RangeOperation> operations, int lengthA, int lengthB) {
        int nextA = 0;
        int nextB = 0;
        for (int index = 0; index < operations.size(); index++) {
            RangeOperation op = operations.get(index);
            if (op.getAStart() != nextA || op.getBStart() != nextB) {
                throw new IllegalStateException("Operation " + index + " " + op
                        + " does not continue at a=" + nextA + ", b=" + nextB);
            }
            if (op.aLength() < 0 || op.bLength() < 0) {
                throw new IllegalStateException("Operation " + index + " " + op + " has a negative range");
            }
            checkShape(index, op);
            nextA = op.getAEnd();
            nextB = op.getBEnd();
        }
        if (nextA != lengthA || nextB != lengthB) {
            throw new IllegalStateException("Operations cover a=[0," + nextA + "), b=[0," + nextB
                    + ") but sequences have lengths " + lengthA + " and " + lengthB);
        }
    }

    private static void checkShape(int index, RangeOperation op) {
        boolean aEmpty = op.aLength() == 0;
        boolean bEmpty = op.bLength() == 0;
        boolean valid;
        switch (op.getTag()) {
            case INSERT:
                valid = aEmpty && !bEmpty;
                break;
            case DELETE:
                valid = !aEmpty && bEmpty;
                break;
            default:
                valid = !aEmpty && !bEmpty;
                break;
        }
        if (!valid) {
            throw new IllegalStateException("Operation " + index + " " + op + " has ranges inconsistent with its tag");
        }
    }
}
