package guraa.pdfdiff.model;

import lombok.Value;

/**
 * Axis-aligned rectangle with a top-left origin and y growing downward.
 * Boxes with x1 &lt; x0 or y1 &lt; y0 are representable; nothing here rejects them.
 */
@Value
public class BoundingBox {
    double x0;
    double y0;
    double x1;
    double y1;

    public static BoundingBox of(double x0, double y0, double x1, double y1) {
        return new BoundingBox(x0, y0, x1, y1);
    }

    public double getWidth() {
        return x1 - x0;
    }

    public double getHeight() {
        return y1 - y0;
    }

    /**
     * @return true if the corners are ordered (x0 &lt;= x1 and y0 &lt;= y1)
     */
    public boolean isWellFormed() {
        return x0 <= x1 && y0 <= y1;
    }
}
