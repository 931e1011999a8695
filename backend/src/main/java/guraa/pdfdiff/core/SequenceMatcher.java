package guraa.pdfdiff.core;

import guraa.pdfdiff.model.DiffTag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ratcliff-Obershelp sequence matcher.
 *
 * Finds the longest contiguous block common to both sequences, then repeats on the
 * pieces to the left and to the right of it. Among blocks of equal length the one
 * starting earliest in A wins, then the one starting earliest in B. The resulting
 * matching blocks drive both the similarity ratio and the opcode decomposition.
 *
 * <p>Elements must implement {@code equals} and {@code hashCode}. Instances are not
 * thread-safe because results are computed lazily and cached and the match-length
 * buffers are reused between calls; create one per pair.
 *
 * @param <T> element type
 */
public final class SequenceMatcher<T> {

    /**
     * Sequences of B shorter than this never have popular elements pruned.
     */
    static final int AUTOJUNK_MIN_LENGTH = 200;

    private static final int[] NO_POSITIONS = new int[0];

    private final List<T> a;
    private final List<T> b;
    private final Map<T, int[]> b2j;

    // Match lengths by j + 1 for the previous and the current row of A; all zero between calls
    private final int[] j2len;
    private final int[] newJ2len;
    private final int[] touched;
    private final int[] newTouched;

    private List<MatchingBlock> matchingBlocks;
    private List<Opcode> opcodes;

    public SequenceMatcher(List<T> a, List<T> b) {
        this(a, b, false);
    }

    /**
     * @param a        First sequence
     * @param b        Second sequence
     * @param autojunk If true and B has at least 200 elements, elements that occur in B more
     *                 than {@code 1% + 1} times are not used to anchor a match (they can still
     *                 extend one)
     */
    public SequenceMatcher(List<T> a, List<T> b, boolean autojunk) {
        this.a = Objects.requireNonNull(a, "a");
        this.b = Objects.requireNonNull(b, "b");
        this.b2j = indexOf(b, autojunk);
        this.j2len = new int[b.size() + 1];
        this.newJ2len = new int[b.size() + 1];
        this.touched = new int[b.size()];
        this.newTouched = new int[b.size()];
    }

    private static <T> Map<T, int[]> indexOf(List<T> b, boolean autojunk) {
        Map<T, List<Integer>> positions = new HashMap<>();
        for (int j = 0; j < b.size(); j++) {
            positions.computeIfAbsent(b.get(j), key -> new ArrayList<>()).add(j);
        }
        int n = b.size();
        int popularThreshold = autojunk && n >= AUTOJUNK_MIN_LENGTH ? n / 100 + 1 : Integer.MAX_VALUE;

        Map<T, int[]> index = new HashMap<>();
        for (Map.Entry<T, List<Integer>> entry : positions.entrySet()) {
            if (entry.getValue().size() <= popularThreshold) {
                index.put(entry.getKey(), entry.getValue().stream().mapToInt(Integer::intValue).toArray());
            }
        }
        return index;
    }

    /**
     * Find the longest matching block in {@code a[aLow, aHigh)} and {@code b[bLow, bHigh)}.
     *
     * @return the block, with size 0 if there is none
     */
    public MatchingBlock findLongestMatch(int aLow, int aHigh, int bLow, int bHigh) {
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;

        int[] previous = j2len;
        int[] current = newJ2len;
        int[] previousTouched = touched;
        int[] currentTouched = newTouched;
        int previousCount = 0;
        for (int i = aLow; i < aHigh; i++) {
            int currentCount = 0;
            int[] positions = b2j.getOrDefault(a.get(i), NO_POSITIONS);
            for (int j : positions) {
                if (j < bLow) {
                    continue;
                }
                if (j >= bHigh) {
                    break;
                }
                // previous[j] is the length of the match ending at a[i-1] and b[j-1]
                int k = previous[j] + 1;
                current[j + 1] = k;
                currentTouched[currentCount++] = j + 1;
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            for (int t = 0; t < previousCount; t++) {
                previous[previousTouched[t]] = 0;
            }

            int[] swap = previous;
            previous = current;
            current = swap;
            swap = previousTouched;
            previousTouched = currentTouched;
            currentTouched = swap;
            previousCount = currentCount;
        }
        for (int t = 0; t < previousCount; t++) {
            previous[previousTouched[t]] = 0;
        }

        // Elements pruned as popular cannot anchor a block but may still extend one.
        while (bestI > aLow && bestJ > bLow && a.get(bestI - 1).equals(b.get(bestJ - 1))) {
            bestI--;
            bestJ--;
            bestSize++;
        }
        while (bestI + bestSize < aHigh && bestJ + bestSize < bHigh
                && a.get(bestI + bestSize).equals(b.get(bestJ + bestSize))) {
            bestSize++;
        }
        return new MatchingBlock(bestI, bestJ, bestSize);
    }

    /**
     * Non-overlapping matching blocks in ascending order, adjacent blocks merged, terminated
     * by the sentinel {@code (len(a), len(b), 0)}.
     */
    public List<MatchingBlock> getMatchingBlocks() {
        if (matchingBlocks != null) {
            return matchingBlocks;
        }
        int la = a.size();
        int lb = b.size();

        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, la, 0, lb});
        List<MatchingBlock> found = new ArrayList<>();
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int aLow = range[0];
            int aHigh = range[1];
            int bLow = range[2];
            int bHigh = range[3];
            MatchingBlock block = findLongestMatch(aLow, aHigh, bLow, bHigh);
            if (block.getSize() > 0) {
                found.add(block);
                int i = block.getAStart();
                int j = block.getBStart();
                int k = block.getSize();
                if (aLow < i && bLow < j) {
                    queue.push(new int[]{aLow, i, bLow, j});
                }
                if (i + k < aHigh && j + k < bHigh) {
                    queue.push(new int[]{i + k, aHigh, j + k, bHigh});
                }
            }
        }
        Collections.sort(found);

        List<MatchingBlock> merged = new ArrayList<>();
        int i1 = 0;
        int j1 = 0;
        int k1 = 0;
        for (MatchingBlock block : found) {
            if (i1 + k1 == block.getAStart() && j1 + k1 == block.getBStart()) {
                k1 += block.getSize();
            } else {
                if (k1 > 0) {
                    merged.add(new MatchingBlock(i1, j1, k1));
                }
                i1 = block.getAStart();
                j1 = block.getBStart();
                k1 = block.getSize();
            }
        }
        if (k1 > 0) {
            merged.add(new MatchingBlock(i1, j1, k1));
        }
        merged.add(new MatchingBlock(la, lb, 0));

        matchingBlocks = Collections.unmodifiableList(merged);
        return matchingBlocks;
    }

    /**
     * Edit script turning A into B. Equal runs alternate with a single REPLACE, DELETE or
     * INSERT per maximal mismatch run; the ranges tile both sequences.
     */
    public List<Opcode> getOpcodes() {
        if (opcodes != null) {
            return opcodes;
        }
        List<Opcode> result = new ArrayList<>();
        int i = 0;
        int j = 0;
        for (MatchingBlock block : getMatchingBlocks()) {
            int ai = block.getAStart();
            int bj = block.getBStart();
            DiffTag tag = null;
            if (i < ai && j < bj) {
                tag = DiffTag.REPLACE;
            } else if (i < ai) {
                tag = DiffTag.DELETE;
            } else if (j < bj) {
                tag = DiffTag.INSERT;
            }
            if (tag != null) {
                result.add(new Opcode(tag, i, ai, j, bj));
            }
            i = ai + block.getSize();
            j = bj + block.getSize();
            if (block.getSize() > 0) {
                result.add(new Opcode(DiffTag.EQUAL, ai, i, bj, j));
            }
        }
        opcodes = Collections.unmodifiableList(result);
        return opcodes;
    }

    /**
     * Number of elements covered by matching blocks.
     */
    public int matchedCount() {
        int matched = 0;
        for (MatchingBlock block : getMatchingBlocks()) {
            matched += block.getSize();
        }
        return matched;
    }

    /**
     * {@code 2 * M / T} where M is the matched element count and T the total length of
     * both sequences; 1.0 when both are empty.
     */
    public double ratio() {
        int total = a.size() + b.size();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchedCount() / total;
    }
}
