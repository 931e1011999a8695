package guraa.pdfdiff.extraction;

import guraa.pdfdiff.model.PageDimensions;
import guraa.pdfdiff.model.PageText;
import guraa.pdfdiff.model.Word;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PDFBox implementation of {@link DocumentExtractor}.
 *
 * A page whose text cannot be extracted is logged and treated as empty so that one
 * damaged page does not abort the whole comparison.
 */
@Slf4j
@Component
public class PdfBoxDocumentExtractor implements DocumentExtractor {

    @Override
    public List<PageText> extractText(PDDocument document) {
        int pageCount = document.getNumberOfPages();
        List<PageText> pages = new ArrayList<>(pageCount);
        for (int i = 0; i < pageCount; i++) {
            pages.add(PageText.of(i, extractTextFromPage(document, i)));
        }
        log.debug("Extracted text of {} pages", pageCount);
        return pages;
    }

    /**
     * Extract text from a specific page in a PDF document.
     *
     * @param document  The PDF document
     * @param pageIndex The zero-based page index
     * @return Extracted text without trailing whitespace, empty on failure
     */
    String extractTextFromPage(PDDocument document, int pageIndex) {
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setStartPage(pageIndex + 1); // 1-based page numbers
            stripper.setEndPage(pageIndex + 1);

            StringWriter writer = new StringWriter();
            stripper.writeText(document, writer);
            return writer.toString().stripTrailing();
        } catch (IOException e) {
            log.warn("Error extracting text from page {}: {}", pageIndex + 1, e.getMessage());
            return "";
        }
    }

    @Override
    public List<Word> extractWords(PDDocument document, int pageIndex) {
        try {
            WordCollectingStripper stripper = new WordCollectingStripper();
            stripper.setStartPage(pageIndex + 1);
            stripper.setEndPage(pageIndex + 1);
            stripper.getText(document);

            List<Word> words = stripper.getWords();
            log.debug("Extracted {} words from page {}", words.size(), pageIndex + 1);
            return Collections.unmodifiableList(words);
        } catch (IOException e) {
            log.warn("Error extracting words from page {}: {}", pageIndex + 1, e.getMessage());
            return Collections.emptyList();
        }
    }

    @Override
    public PageDimensions pageDimensions(PDDocument document, int pageIndex) {
        PDPage page = document.getPage(pageIndex);
        PDRectangle box = page.getCropBox();
        if (box == null || box.getWidth() <= 0 || box.getHeight() <= 0) {
            log.warn("Page {} has no usable crop box, using US Letter", pageIndex + 1);
            return PageDimensions.LETTER;
        }
        return PageDimensions.of(box.getWidth(), box.getHeight());
    }
}
