package guraa.pdfdiff;

import guraa.pdfdiff.config.PdfDiffProperties;
import guraa.pdfdiff.core.PageAligner;
import guraa.pdfdiff.service.DocumentComparisonService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "pdfdiff.alignment.lookahead-window=5")
class PDFDiffApplicationTests {

    @Autowired
    private DocumentComparisonService documentComparisonService;

    @Autowired
    private PdfDiffProperties properties;

    @Test
    void testContextLoads() {
        assertNotNull(documentComparisonService);
    }

    @Test
    void testPropertiesAreBound() {
        assertEquals(5, properties.getAlignment().getLookaheadWindow());
        assertEquals(PageAligner.DEFAULT_SIMILARITY_THRESHOLD, properties.getAlignment().getSimilarityThreshold());
        assertEquals(PdfDiffProperties.LayoutMode.VECTOR, properties.getLayout().getMode());
        assertFalse(properties.getSimilarity().isAutojunk());
    }
}
