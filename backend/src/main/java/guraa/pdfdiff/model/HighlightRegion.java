package guraa.pdfdiff.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A rectangle to highlight in the output layout.
 */
@Value
public class HighlightRegion {

    /**
     * The document whose page the region sits on.
     */
    @NonNull
    Side side;

    /**
     * Region in output coordinates.
     */
    @NonNull
    BoundingBox bbox;

    @NonNull
    HighlightKind kind;
}
