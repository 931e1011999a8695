package guraa.pdfdiff.util;

import guraa.pdfdiff.model.BoundingBox;
import guraa.pdfdiff.model.PageDimensions;
import guraa.pdfdiff.model.PageTransform;
import org.springframework.stereotype.Component;

/**
 * Utility class for projecting boxes from a page's native space into the output layout.
 *
 * Scale factors are independent per axis and per document, since the two documents
 * may have different page sizes. Both corners are mapped independently; a box with
 * x1 &lt; x0 or y1 &lt; y0 is mapped as given, validation is up to the caller.
 */
@Component
public class CoordinateMapper {

    /**
     * Map a box with explicit scale factors and offsets.
     *
     * @param bbox    Box in source coordinates
     * @param scaleX  Target width / source width
     * @param scaleY  Target height / source height
     * @param offsetX Horizontal offset added after scaling
     * @param offsetY Vertical offset added after scaling
     * @return Box in target coordinates
     */
    public BoundingBox map(BoundingBox bbox, double scaleX, double scaleY, double offsetX, double offsetY) {
        return new BoundingBox(
                bbox.getX0() * scaleX + offsetX,
                bbox.getY0() * scaleY + offsetY,
                bbox.getX1() * scaleX + offsetX,
                bbox.getY1() * scaleY + offsetY);
    }

    /**
     * Map a box through a page transform.
     *
     * @param bbox      Box in source coordinates
     * @param transform Transform into the target space
     * @return Box in target coordinates
     */
    public BoundingBox map(BoundingBox bbox, PageTransform transform) {
        return map(bbox, transform.getScaleX(), transform.getScaleY(), transform.getOffsetX(), transform.getOffsetY());
    }

    /**
     * The single transform equivalent to applying {@code first} and then {@code second}.
     *
     * @param first  Transform applied first
     * @param second Transform applied second
     * @return Composite transform
     */
    public PageTransform compose(PageTransform first, PageTransform second) {
        return new PageTransform(
                first.getScaleX() * second.getScaleX(),
                first.getScaleY() * second.getScaleY(),
                first.getOffsetX() * second.getScaleX() + second.getOffsetX(),
                first.getOffsetY() * second.getScaleY() + second.getOffsetY());
    }

    /**
     * Scale factors that stretch a page of the given native size onto a target of the
     * given size, with no offset.
     *
     * @param source       Native page dimensions
     * @param targetWidth  Width of the page in the target space
     * @param targetHeight Height of the page in the target space
     * @return Pure scaling transform
     */
    public PageTransform scaleFor(PageDimensions source, double targetWidth, double targetHeight) {
        return new PageTransform(targetWidth / source.getWidth(), targetHeight / source.getHeight(), 0.0, 0.0);
    }
}
