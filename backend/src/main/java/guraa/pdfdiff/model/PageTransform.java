package guraa.pdfdiff.model;

import lombok.Value;

/**
 * Axis-aligned affine transform from a page's native space into the output layout:
 * {@code x' = x * scaleX + offsetX}, {@code y' = y * scaleY + offsetY}.
 */
@Value
public class PageTransform {

    public static final PageTransform IDENTITY = new PageTransform(1.0, 1.0, 0.0, 0.0);

    double scaleX;
    double scaleY;
    double offsetX;
    double offsetY;

    public static PageTransform of(double scaleX, double scaleY, double offsetX, double offsetY) {
        return new PageTransform(scaleX, scaleY, offsetX, offsetY);
    }

    public static PageTransform translation(double offsetX, double offsetY) {
        return new PageTransform(1.0, 1.0, offsetX, offsetY);
    }
}
