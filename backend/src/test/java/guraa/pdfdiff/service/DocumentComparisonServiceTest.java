package guraa.pdfdiff.service;

import guraa.pdfdiff.config.PdfDiffProperties;
import guraa.pdfdiff.core.PageAligner;
import guraa.pdfdiff.core.SimilarityScorer;
import guraa.pdfdiff.core.WordDiffer;
import guraa.pdfdiff.extraction.PdfBoxDocumentExtractor;
import guraa.pdfdiff.layout.PageLayoutFactory;
import guraa.pdfdiff.model.AlignmentOp;
import guraa.pdfdiff.model.ComparisonReport;
import guraa.pdfdiff.model.PageStatus;
import guraa.pdfdiff.model.Side;
import guraa.pdfdiff.util.CoordinateMapper;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class DocumentComparisonServiceTest {

    static final String INTRO = "Introduction to the quarterly report";
    static final String FINANCE = "Financial results for the third quarter";
    static final String APPENDIX = "A brand new appendix page";

    @TempDir
    Path tempDir;

    private DocumentComparisonService service;

    @BeforeEach
    void setUp() {
        PdfDiffProperties properties = new PdfDiffProperties();
        CoordinateMapper mapper = new CoordinateMapper();
        service = new DocumentComparisonService(
                new PdfBoxDocumentExtractor(),
                new PageAligner(new SimilarityScorer(properties), properties),
                new PageLayoutFactory(properties, mapper),
                new DiffReportPlanner(new WordDiffer(), mapper, properties, Runnable::run),
                new TextDiffService());
    }

    /**
     * Write a PDF with one line of text per page.
     */
    static File writePdf(Path dir, String name, String... pages) throws IOException {
        File file = dir.resolve(name).toFile();
        try (PDDocument document = new PDDocument()) {
            for (String text : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(PDType1Font.HELVETICA, 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(text);
                    content.endText();
                }
            }
            document.save(file);
        }
        return file;
    }

    @Test
    void testInsertedPage() throws IOException {
        File original = writePdf(tempDir, "a.pdf", INTRO, FINANCE);
        File modified = writePdf(tempDir, "b.pdf", INTRO, APPENDIX, FINANCE);

        ComparisonReport report = service.compare(original, modified);

        assertEquals(2, report.getPageCountA());
        assertEquals(3, report.getPageCountB());
        assertEquals(Arrays.asList(
                AlignmentOp.equal(0, 1, 0, 1),
                AlignmentOp.insert(1, 1, 2),
                AlignmentOp.equal(1, 2, 2, 3)), report.getPlan().getOperations());

        assertEquals(3, report.getPages().size());
        assertEquals(PageStatus.UNCHANGED, report.getPages().get(0).getStatus());
        assertEquals(PageStatus.ADDED, report.getPages().get(1).getStatus());
        assertEquals(PageStatus.SHIFTED, report.getPages().get(2).getStatus());
        assertEquals("Original - Page 2 | Modified - Page 3 (Shifted)",
                report.getPages().get(2).getLabel());
        assertEquals(0, report.getRegionCount());
        assertTrue(report.getTextDiff().contains("+" + APPENDIX));
        assertTrue(report.hasDifferences());
    }

    @Test
    void testChangedWordIsHighlighted() throws IOException {
        File original = writePdf(tempDir, "a.pdf", FINANCE);
        File modified = writePdf(tempDir, "b.pdf", "Financial results for the fourth quarter");

        ComparisonReport report = service.compare(original, modified);

        assertEquals(PageStatus.CHANGED, report.getPages().get(0).getStatus());
        assertEquals(2, report.getRegionCount());
        assertEquals(1, report.getPages().get(0).getRegions(Side.A).size());
    }

    @Test
    void testIdenticalDocuments() throws IOException {
        File original = writePdf(tempDir, "a.pdf", INTRO, FINANCE);
        File copy = writePdf(tempDir, "b.pdf", INTRO, FINANCE);

        ComparisonReport report = service.compare(original, copy);

        assertEquals(1, report.getPlan().size());
        assertFalse(report.hasDifferences());
        assertTrue(report.getTextDiff().isEmpty());
    }

    @Test
    void testMissingFile() throws IOException {
        File original = writePdf(tempDir, "a.pdf", INTRO);
        File missing = tempDir.resolve("missing.pdf").toFile();

        assertThrows(ComparisonException.class, () -> service.compare(original, missing));
    }
}
