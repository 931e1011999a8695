package guraa.pdfdiff.extraction;

import guraa.pdfdiff.model.PageDimensions;
import guraa.pdfdiff.model.PageText;
import guraa.pdfdiff.model.Word;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads what the comparison engine needs from a document: page text, words with
 * bounding boxes and page sizes.
 */
public interface DocumentExtractor {

    /**
     * Text of every page, in page order. Pages without text yield empty content.
     */
    List<PageText> extractText(PDDocument document);

    /**
     * Words of one page in reading order, with boxes in top-left page coordinates.
     */
    List<Word> extractWords(PDDocument document, int pageIndex);

    /**
     * Native size of one page.
     */
    PageDimensions pageDimensions(PDDocument document, int pageIndex);

    default List<PageDimensions> pageDimensions(PDDocument document) {
        List<PageDimensions> dimensions = new ArrayList<>(document.getNumberOfPages());
        for (int i = 0; i < document.getNumberOfPages(); i++) {
            dimensions.add(pageDimensions(document, i));
        }
        return dimensions;
    }
}
