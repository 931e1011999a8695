package guraa.pdfdiff.extraction;

import guraa.pdfdiff.model.PageDimensions;
import guraa.pdfdiff.model.PageText;
import guraa.pdfdiff.model.Word;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PdfBoxDocumentExtractorTest {

    private final PdfBoxDocumentExtractor extractor = new PdfBoxDocumentExtractor();
    private PDDocument document;

    @BeforeEach
    void setUp() throws IOException {
        document = new PDDocument();
        addTextPage(document, PDRectangle.LETTER, "Hello World", "Second line here");
        document.addPage(new PDPage(PDRectangle.LETTER));
        addTextPage(document, PDRectangle.A4, "A4 page");
    }

    @AfterEach
    void tearDown() throws IOException {
        document.close();
    }

    /**
     * Add a page with one line of Helvetica text per entry, starting one inch from the
     * left edge at y = 700.
     */
    static void addTextPage(PDDocument document, PDRectangle size, String... lines) throws IOException {
        PDPage page = new PDPage(size);
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.beginText();
            content.setFont(PDType1Font.HELVETICA, 12);
            content.newLineAtOffset(72, 700);
            for (String line : lines) {
                content.showText(line);
                content.newLineAtOffset(0, -20);
            }
            content.endText();
        }
    }

    @Test
    void testExtractText() {
        List<PageText> pages = extractor.extractText(document);

        assertEquals(3, pages.size());
        assertEquals(0, pages.get(0).getIndex());
        assertTrue(pages.get(0).getContent().startsWith("Hello World"));
        assertTrue(pages.get(0).getContent().contains("Second line here"));
        assertTrue(pages.get(1).isBlank());
        assertEquals("", pages.get(1).getContent());
        assertEquals("A4 page", pages.get(2).getContent());
    }

    @Test
    void testExtractWords() {
        List<Word> words = extractor.extractWords(document, 0);

        assertEquals(List.of("Hello", "World", "Second", "line", "here"),
                words.stream().map(Word::getText).collect(Collectors.toList()));

        Word hello = words.get(0);
        Word world = words.get(1);
        assertEquals(72.0, hello.getBbox().getX0(), 0.5);
        // baseline at y = 700 in PDF space is 92 points from the top
        assertEquals(92.0, hello.getBbox().getY1(), 0.5);
        assertTrue(hello.getBbox().isWellFormed());
        assertTrue(hello.getBbox().getHeight() > 0);
        assertTrue(hello.getBbox().getX1() <= world.getBbox().getX0());
        assertTrue(words.get(2).getBbox().getY0() > hello.getBbox().getY1());
    }

    @Test
    void testBlankPageHasNoWords() {
        assertTrue(extractor.extractWords(document, 1).isEmpty());
    }

    @Test
    void testPageDimensions() {
        assertEquals(PageDimensions.of(612, 792), extractor.pageDimensions(document, 0));
        List<PageDimensions> all = extractor.pageDimensions(document);
        assertEquals(3, all.size());
        assertEquals(PDRectangle.A4.getWidth(), all.get(2).getWidth(), 1e-3);
        assertEquals(PDRectangle.A4.getHeight(), all.get(2).getHeight(), 1e-3);
    }

    @Test
    void testLoadMissingFile(@TempDir Path tempDir) {
        File missing = tempDir.resolve("missing.pdf").toFile();

        assertThrows(IOException.class, () -> PdfDocumentLoader.load(missing));
    }

    @Test
    void testLoadSavedDocument(@TempDir Path tempDir) throws IOException {
        File file = tempDir.resolve("saved.pdf").toFile();
        document.save(file);

        try (PDDocument loaded = PdfDocumentLoader.load(file)) {
            assertEquals(3, loaded.getNumberOfPages());
        }
    }

    @Test
    void testLoadCorruptFile(@TempDir Path tempDir) throws IOException {
        Path corrupt = tempDir.resolve("corrupt.pdf");
        Files.writeString(corrupt, "this is not a pdf");

        assertThrows(IOException.class, () -> PdfDocumentLoader.load(corrupt.toFile()));
    }
}
