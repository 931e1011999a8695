package guraa.pdfdiff.model;

import lombok.Value;

/**
 * Native width and height of a page (PDF points for PDF documents).
 */
@Value
public class PageDimensions {

    /** US Letter, used when a page reports no usable box. */
    public static final PageDimensions LETTER = new PageDimensions(612f, 792f);

    double width;
    double height;

    public static PageDimensions of(double width, double height) {
        return new PageDimensions(width, height);
    }
}
