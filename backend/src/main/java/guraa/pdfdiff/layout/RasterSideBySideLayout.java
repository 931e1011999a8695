package guraa.pdfdiff.layout;

import guraa.pdfdiff.model.PageDimensions;
import guraa.pdfdiff.model.PageTransform;
import guraa.pdfdiff.model.Side;
import guraa.pdfdiff.util.CoordinateMapper;

import java.util.List;

/**
 * Side-by-side layout for pages rendered to images at a fixed DPI and pasted edge to
 * edge: A at the origin, B immediately to its right.
 *
 * Scale factors are image pixels over page points per axis, using the rounded pixel
 * size a renderer produces, so they can differ slightly between axes and documents.
 */
public class RasterSideBySideLayout implements PageLayout {

    private static final double POINTS_PER_INCH = 72.0;

    private final List<PageDimensions> pagesA;
    private final List<PageDimensions> pagesB;
    private final int dpi;
    private final CoordinateMapper coordinateMapper;

    public RasterSideBySideLayout(List<PageDimensions> pagesA, List<PageDimensions> pagesB,
                                  int dpi, CoordinateMapper coordinateMapper) {
        if (dpi <= 0) {
            throw new IllegalArgumentException("DPI must be positive: " + dpi);
        }
        this.pagesA = List.copyOf(pagesA);
        this.pagesB = List.copyOf(pagesB);
        this.dpi = dpi;
        this.coordinateMapper = coordinateMapper;
    }

    @Override
    public PageTransform transformFor(Side side, int pageIndex) {
        return transformFor(side, pageIndex, null);
    }

    @Override
    public PageTransform transformFor(Side side, int pageIndex, Integer partnerIndex) {
        PageDimensions page = side == Side.A ? pagesA.get(pageIndex) : pagesB.get(pageIndex);
        PageDimensions pixels = pixelSize(page);
        PageTransform scale = coordinateMapper.scaleFor(page, pixels.getWidth(), pixels.getHeight());
        if (side == Side.A) {
            return scale;
        }
        double offsetX = partnerIndex != null
                ? pixelSize(pagesA.get(partnerIndex)).getWidth()
                : pixels.getWidth();
        return coordinateMapper.compose(scale, PageTransform.translation(offsetX, 0.0));
    }

    /**
     * Pixel size of a page rendered at this layout's DPI.
     */
    public PageDimensions pixelSize(PageDimensions page) {
        return PageDimensions.of(
                Math.round(page.getWidth() * dpi / POINTS_PER_INCH),
                Math.round(page.getHeight() * dpi / POINTS_PER_INCH));
    }
}
