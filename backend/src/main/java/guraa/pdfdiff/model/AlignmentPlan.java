package guraa.pdfdiff.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered page alignment between two documents.
 *
 * Every page index of A appears in exactly one operation's a-range and every page
 * index of B in exactly one b-range, in ascending order. The constructor enforces
 * this; a plan that breaks it is a bug in whatever produced it.
 */
@Getter
@EqualsAndHashCode
public final class AlignmentPlan implements Iterable<AlignmentOp> {

    private final List<AlignmentOp> operations;
    private final int pageCountA;
    private final int pageCountB;

    public AlignmentPlan(List<AlignmentOp> operations, int pageCountA, int pageCountB) {
        List<AlignmentOp> copy = Collections.unmodifiableList(new ArrayList<>(operations));
        RangeOperation.verifyCoverage(copy, pageCountA, pageCountB);
        this.operations = copy;
        this.pageCountA = pageCountA;
        this.pageCountB = pageCountB;
    }

    public static AlignmentPlan empty() {
        return new AlignmentPlan(Collections.emptyList(), 0, 0);
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public AlignmentOp get(int index) {
        return operations.get(index);
    }

    /**
     * Count the operations carrying the given tag.
     *
     * @param tag The tag to count
     * @return Number of operations with that tag
     */
    public long count(DiffTag tag) {
        return operations.stream().filter(op -> op.getTag() == tag).count();
    }

    @Override
    public Iterator<AlignmentOp> iterator() {
        return operations.iterator();
    }

    @Override
    public String toString() {
        return "AlignmentPlan" + operations;
    }
}
