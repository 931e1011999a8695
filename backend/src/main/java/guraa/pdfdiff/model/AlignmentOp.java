package guraa.pdfdiff.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One step of a page alignment: a range of pages of document A related to a range of
 * pages of document B. Indices are zero-based and ranges half-open.
 */
@Value
public class AlignmentOp implements RangeOperation {

    @NonNull
    DiffTag tag;
    int aStart;
    int aEnd;
    int bStart;
    int bEnd;

    public static AlignmentOp equal(int aStart, int aEnd, int bStart, int bEnd) {
        return new AlignmentOp(DiffTag.EQUAL, aStart, aEnd, bStart, bEnd);
    }

    public static AlignmentOp replace(int aStart, int aEnd, int bStart, int bEnd) {
        return new AlignmentOp(DiffTag.REPLACE, aStart, aEnd, bStart, bEnd);
    }

    /**
     * Pages {@code [bStart, bEnd)} exist only in B; they sit before page {@code aIndex} of A.
     */
    public static AlignmentOp insert(int aIndex, int bStart, int bEnd) {
        return new AlignmentOp(DiffTag.INSERT, aIndex, aIndex, bStart, bEnd);
    }

    /**
     * Pages {@code [aStart, aEnd)} exist only in A; they sit before page {@code bIndex} of B.
     */
    public static AlignmentOp delete(int aStart, int aEnd, int bIndex) {
        return new AlignmentOp(DiffTag.DELETE, aStart, aEnd, bIndex, bIndex);
    }

    /**
     * @return a copy whose ranges are extended by {@code other}'s, which must follow directly
     */
    public AlignmentOp extendWith(AlignmentOp other) {
        if (other.tag != tag || other.aStart != aEnd || other.bStart != bEnd) {
            throw new IllegalArgumentException("Cannot extend " + this + " with " + other);
        }
        return new AlignmentOp(tag, aStart, other.aEnd, bStart, other.bEnd);
    }

    @Override
    public String toString() {
        return tag + "(a=[" + aStart + "," + aEnd + "), b=[" + bStart + "," + bEnd + "))";
    }
}
