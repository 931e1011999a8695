package guraa.pdfdiff.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A word on a page together with its bounding box in document-native units.
 * Only the text takes part in diffing; the box is carried along for highlighting.
 */
@Value
public class Word {

    @NonNull
    String text;

    @NonNull
    BoundingBox bbox;

    public Word(@NonNull String text, @NonNull BoundingBox bbox) {
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Word text must not be empty");
        }
        this.text = text;
        this.bbox = bbox;
    }

    public static Word of(String text, double x0, double y0, double x1, double y1) {
        return new Word(text, BoundingBox.of(x0, y0, x1, y1));
    }
}
