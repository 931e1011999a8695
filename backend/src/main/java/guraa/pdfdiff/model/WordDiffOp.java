package guraa.pdfdiff.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One opcode of a word-level diff between two pages: words {@code [aStart, aEnd)} of
 * the A page related to words {@code [bStart, bEnd)} of the B page.
 */
@Value
public class WordDiffOp implements RangeOperation {

    @NonNull
    DiffTag tag;
    int aStart;
    int aEnd;
    int bStart;
    int bEnd;

    /**
     * @return true if the op marks words of page A as removed
     */
    public boolean removesWords() {
        return tag == DiffTag.REPLACE || tag == DiffTag.DELETE;
    }

    /**
     * @return true if the op marks words of page B as added
     */
    public boolean addsWords() {
        return tag == DiffTag.REPLACE || tag == DiffTag.INSERT;
    }

    @Override
    public String toString() {
        return tag + "(a=[" + aStart + "," + aEnd + "), b=[" + bStart + "," + bEnd + "))";
    }
}
