package guraa.pdfdiff.service;

import guraa.pdfdiff.core.PageAligner;
import guraa.pdfdiff.extraction.DocumentExtractor;
import guraa.pdfdiff.extraction.PdfDocumentLoader;
import guraa.pdfdiff.layout.PageLayout;
import guraa.pdfdiff.layout.PageLayoutFactory;
import guraa.pdfdiff.model.AlignmentPlan;
import guraa.pdfdiff.model.ComparisonReport;
import guraa.pdfdiff.model.PageComparisonResult;
import guraa.pdfdiff.model.PageText;
import guraa.pdfdiff.model.Side;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Runs a complete comparison of two PDF documents: text extraction, page alignment,
 * word diffs of matched pages and the full-text diff.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentComparisonService {

    private final DocumentExtractor documentExtractor;
    private final PageAligner pageAligner;
    private final PageLayoutFactory pageLayoutFactory;
    private final DiffReportPlanner diffReportPlanner;
    private final TextDiffService textDiffService;

    /**
     * Compare two PDF files.
     *
     * @param fileA The original document
     * @param fileB The modified document
     * @return The comparison report
     * @throws ComparisonException If either document cannot be opened
     */
    public ComparisonReport compare(File fileA, File fileB) {
        log.info("Comparing '{}' and '{}'", fileA.getName(), fileB.getName());
        try (PDDocument documentA = PdfDocumentLoader.load(fileA);
             PDDocument documentB = PdfDocumentLoader.load(fileB)) {
            return compare(documentA, documentB);
        } catch (IOException e) {
            throw new ComparisonException("Failed to open documents for comparison: " + e.getMessage(), e);
        }
    }

    /**
     * Compare two open documents. The documents stay open and are only read.
     *
     * @param documentA The original document
     * @param documentB The modified document
     * @return The comparison report
     */
    public ComparisonReport compare(PDDocument documentA, PDDocument documentB) {
        long startTime = System.currentTimeMillis();

        List<PageText> textA = documentExtractor.extractText(documentA);
        List<PageText> textB = documentExtractor.extractText(documentB);

        AlignmentPlan plan = pageAligner.align(textA, textB);

        PageLayout layout = pageLayoutFactory.create(
                documentExtractor.pageDimensions(documentA),
                documentExtractor.pageDimensions(documentB));
        WordLookup words = (side, pageIndex) ->
                documentExtractor.extractWords(side == Side.A ? documentA : documentB, pageIndex);
        List<PageComparisonResult> pages = diffReportPlanner.plan(plan, words, layout);

        ComparisonReport report = ComparisonReport.builder()
                .pageCountA(textA.size())
                .pageCountB(textB.size())
                .plan(plan)
                .pages(pages)
                .textDiff(textDiffService.unifiedDiff(textA, textB))
                .build();

        log.info("Compared {} against {} pages in {} ms: {} report pages, {} added, {} missing, {} shifted, {} changed, {} highlighted words",
                report.getPageCountA(), report.getPageCountB(), System.currentTimeMillis() - startTime,
                pages.size(), report.getAddedPageCount(), report.getMissingPageCount(),
                report.getShiftedPairCount(), report.getChangedPairCount(), report.getRegionCount());
        return report;
    }
}
