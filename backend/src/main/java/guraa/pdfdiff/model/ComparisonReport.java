package guraa.pdfdiff.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything one comparison produced, ready to hand to a renderer.
 */
@Value
@Builder
public class ComparisonReport {

    int pageCountA;
    int pageCountB;

    @NonNull
    AlignmentPlan plan;

    /**
     * Report pages in alignment order.
     */
    @Singular
    List<PageComparisonResult> pages;

    /**
     * Unified line diff over the documents' full text. Empty when the text is identical.
     */
    @Singular("textDiffLine")
    List<String> textDiff;

    public long countPages(PageStatus status) {
        return pages.stream().filter(page -> page.getStatus() == status).count();
    }

    public long getAddedPageCount() {
        return countPages(PageStatus.ADDED);
    }

    public long getMissingPageCount() {
        return countPages(PageStatus.MISSING);
    }

    public long getChangedPairCount() {
        return countPages(PageStatus.CHANGED);
    }

    public long getShiftedPairCount() {
        return pages.stream().filter(PageComparisonResult::isShifted).count();
    }

    public int getRegionCount() {
        return pages.stream().mapToInt(page -> page.getRegions().size()).sum();
    }

    /**
     * @return true if any page was added, removed, moved or has highlighted words
     */
    public boolean hasDifferences() {
        return pages.stream().anyMatch(page -> page.getStatus() != PageStatus.UNCHANGED);
    }
}
