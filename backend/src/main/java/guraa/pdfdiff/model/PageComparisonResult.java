package guraa.pdfdiff.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One entry of the comparison output, which a renderer turns into one report page.
 *
 * Either both page indices are present (a matched pair), or exactly one is
 * (a page that exists on one side only). Indices are zero-based.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PageComparisonResult {

    private final Integer aIndex;
    private final Integer bIndex;

    /**
     * True for a matched pair whose indices differ. Always false for singletons.
     */
    private final boolean shifted;

    private final List<HighlightRegion> regions;

    private PageComparisonResult(Integer aIndex, Integer bIndex, boolean shifted, List<HighlightRegion> regions) {
        if (aIndex == null && bIndex == null) {
            throw new IllegalArgumentException("At least one page index must be present");
        }
        this.aIndex = aIndex;
        this.bIndex = bIndex;
        this.shifted = shifted;
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
    }

    /**
     * A matched page pair with its highlighted word regions.
     */
    public static PageComparisonResult pair(int aIndex, int bIndex, List<HighlightRegion> regions) {
        return new PageComparisonResult(aIndex, bIndex, aIndex != bIndex, regions);
    }

    /**
     * A page of A with no counterpart in B.
     */
    public static PageComparisonResult onlyInA(int aIndex) {
        return new PageComparisonResult(aIndex, null, false, Collections.emptyList());
    }

    /**
     * A page of B with no counterpart in A.
     */
    public static PageComparisonResult onlyInB(int bIndex) {
        return new PageComparisonResult(null, bIndex, false, Collections.emptyList());
    }

    public Optional<Integer> aPage() {
        return Optional.ofNullable(aIndex);
    }

    public Optional<Integer> bPage() {
        return Optional.ofNullable(bIndex);
    }

    public boolean isPair() {
        return aIndex != null && bIndex != null;
    }

    public List<HighlightRegion> getRegions(Side side) {
        return regions.stream()
                .filter(region -> region.getSide() == side)
                .collect(Collectors.toList());
    }

    public PageStatus getStatus() {
        if (aIndex == null) {
            return PageStatus.ADDED;
        }
        if (bIndex == null) {
            return PageStatus.MISSING;
        }
        if (!regions.isEmpty()) {
            return PageStatus.CHANGED;
        }
        return shifted ? PageStatus.SHIFTED : PageStatus.UNCHANGED;
    }

    /**
     * Caption for the report page, using one-based page numbers.
     */
    public String getLabel() {
        switch (getStatus()) {
            case ADDED:
                return "Added - Page " + (bIndex + 1);
            case MISSING:
                return "Missing - Page " + (aIndex + 1);
            default:
                StringBuilder label = new StringBuilder()
                        .append("Original - Page ").append(aIndex + 1)
                        .append(" | Modified - Page ").append(bIndex + 1);
                if (shifted) {
                    label.append(" (Shifted)");
                }
                if (getStatus() == PageStatus.UNCHANGED) {
                    label.append(" (No Differences)");
                }
                return label.toString();
        }
    }
}
