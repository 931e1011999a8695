package guraa.pdfdiff.layout;

import guraa.pdfdiff.model.PageDimensions;
import guraa.pdfdiff.model.PageTransform;
import guraa.pdfdiff.model.Side;

import java.util.List;

/**
 * Side-by-side layout that keeps pages at their native size.
 *
 * <pre>
 *  margin | label strip A | gap | label strip B | margin
 *  margin | page A        | gap | page B        | margin
 * </pre>
 *
 * Page A starts at {@code (margin, margin + labelHeight)}; page B starts {@code gap} to
 * the right of the A column. A singleton page of B is placed as if paired with a blank
 * page of its own size.
 */
public class VectorSideBySideLayout implements PageLayout {

    private final List<PageDimensions> pagesA;
    private final List<PageDimensions> pagesB;
    private final double margin;
    private final double gap;
    private final double labelHeight;

    public VectorSideBySideLayout(List<PageDimensions> pagesA, List<PageDimensions> pagesB,
                                  double margin, double gap, double labelHeight) {
        this.pagesA = List.copyOf(pagesA);
        this.pagesB = List.copyOf(pagesB);
        this.margin = margin;
        this.gap = gap;
        this.labelHeight = labelHeight;
    }

    @Override
    public PageTransform transformFor(Side side, int pageIndex) {
        return transformFor(side, pageIndex, null);
    }

    @Override
    public PageTransform transformFor(Side side, int pageIndex, Integer partnerIndex) {
        double top = margin + labelHeight;
        if (side == Side.A) {
            return PageTransform.translation(margin, top);
        }
        double leftColumnWidth = partnerIndex != null
                ? pagesA.get(partnerIndex).getWidth()
                : pagesB.get(pageIndex).getWidth();
        return PageTransform.translation(margin + leftColumnWidth + gap, top);
    }

    /**
     * Size of the output page holding page {@code aIndex} of A next to page {@code bIndex}
     * of B.
     */
    public PageDimensions canvasFor(int aIndex, int bIndex) {
        PageDimensions a = pagesA.get(aIndex);
        PageDimensions b = pagesB.get(bIndex);
        return PageDimensions.of(
                a.getWidth() + b.getWidth() + gap + 2 * margin,
                Math.max(a.getHeight(), b.getHeight()) + 2 * margin + labelHeight);
    }
}
