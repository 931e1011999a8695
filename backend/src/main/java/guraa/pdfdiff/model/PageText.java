package guraa.pdfdiff.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Plain text of a single page. Content is empty for blank or image-only pages.
 */
@Value
public class PageText {

    /**
     * Zero-based page index within its document.
     */
    int index;

    /**
     * Extracted page text, never null.
     */
    @NonNull
    String content;

    public static PageText of(int index, String content) {
        if (index < 0) {
            throw new IllegalArgumentException("Page index must be non-negative: " + index);
        }
        return new PageText(index, content == null ? "" : content);
    }

    public boolean isBlank() {
        return content.isBlank();
    }
}
