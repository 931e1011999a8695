package guraa.pdfdiff.core;

import lombok.Value;

/**
 * A run of {@code size} equal elements: {@code a[aStart, aStart+size) == b[bStart, bStart+size)}.
 */
@Value
public class MatchingBlock implements Comparable<MatchingBlock> {
    int aStart;
    int bStart;
    int size;

    @Override
    public int compareTo(MatchingBlock other) {
        if (aStart != other.aStart) {
            return Integer.compare(aStart, other.aStart);
        }
        if (bStart != other.bStart) {
            return Integer.compare(bStart, other.bStart);
        }
        return Integer.compare(size, other.size);
    }
}
