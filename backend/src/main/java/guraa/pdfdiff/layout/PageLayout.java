package guraa.pdfdiff.layout;

import guraa.pdfdiff.model.PageTransform;
import guraa.pdfdiff.model.Side;

/**
 * Places a document page in the output layout.
 */
@FunctionalInterface
public interface PageLayout {

    /**
     * Transform from the native space of page {@code pageIndex} of {@code side} into output
     * coordinates.
     */
    PageTransform transformFor(Side side, int pageIndex);

    /**
     * Transform for a page shown next to {@code partnerIndex} of the other document, or on
     * its own when {@code partnerIndex} is null. Layouts whose placement depends on the
     * neighbouring page override this.
     */
    default PageTransform transformFor(Side side, int pageIndex, Integer partnerIndex) {
        return transformFor(side, pageIndex);
    }

    /**
     * Layout that leaves every page in its native coordinates.
     */
    static PageLayout identity() {
        return (side, pageIndex) -> PageTransform.IDENTITY;
    }
}
