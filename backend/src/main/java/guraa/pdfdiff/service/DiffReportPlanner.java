package guraa.pdfdiff.service;

import guraa.pdfdiff.config.PdfDiffProperties;
import guraa.pdfdiff.core.WordDiffer;
import guraa.pdfdiff.layout.PageLayout;
import guraa.pdfdiff.model.AlignmentOp;
import guraa.pdfdiff.model.AlignmentPlan;
import guraa.pdfdiff.model.DiffTag;
import guraa.pdfdiff.model.HighlightKind;
import guraa.pdfdiff.model.HighlightRegion;
import guraa.pdfdiff.model.PageComparisonResult;
import guraa.pdfdiff.model.PageTransform;
import guraa.pdfdiff.model.Side;
import guraa.pdfdiff.model.Word;
import guraa.pdfdiff.model.WordDiffOp;
import guraa.pdfdiff.util.CoordinateMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Turns an alignment plan into the ordered list of report pages.
 *
 * <p>Matched page pairs (from EQUAL and REPLACE operations) are diffed word by word and
 * every changed word is projected into the output layout: words of A as
 * {@link HighlightKind#REMOVED}, words of B as {@link HighlightKind#ADDED}. Pages present
 * on one side only become singleton entries without regions.
 *
 * <p>Results follow plan order and, within an operation, ascending page index. Report
 * pagination relies on this order.
 */
@Slf4j
@Service
public class DiffReportPlanner {

    private final WordDiffer wordDiffer;
    private final CoordinateMapper coordinateMapper;
    private final PdfDiffProperties properties;
    private final Executor pageDiffExecutor;

    public DiffReportPlanner(WordDiffer wordDiffer,
                             CoordinateMapper coordinateMapper,
                             PdfDiffProperties properties,
                             @Qualifier("pageDiffExecutor") Executor pageDiffExecutor) {
        this.wordDiffer = wordDiffer;
        this.coordinateMapper = coordinateMapper;
        this.properties = properties;
        this.pageDiffExecutor = pageDiffExecutor;
    }

    /**
     * Plan the report pages for an alignment.
     *
     * @param alignment  Page alignment of the two documents
     * @param wordLookup Source of page words; only called for matched pairs
     * @param layout     Placement of each page in the output
     * @return One result per report page, in report order
     */
    public List<PageComparisonResult> plan(AlignmentPlan alignment, WordLookup wordLookup, PageLayout layout) {
        boolean parallel = properties.getPlanner().isParallel();
        List<Supplier<PageComparisonResult>> slots = new ArrayList<>();

        for (AlignmentOp op : alignment) {
            if (op.getTag() == DiffTag.EQUAL || op.getTag() == DiffTag.REPLACE) {
                int count = Math.max(op.aLength(), op.bLength());
                for (int k = 0; k < count; k++) {
                    Integer idxA = op.getAStart() + k < op.getAEnd() ? op.getAStart() + k : null;
                    Integer idxB = op.getBStart() + k < op.getBEnd() ? op.getBStart() + k : null;
                    if (idxA != null && idxB != null) {
                        slots.add(pairSlot(idxA, idxB, wordLookup, layout, parallel));
                    } else if (idxA != null) {
                        PageComparisonResult result = PageComparisonResult.onlyInA(idxA);
                        slots.add(() -> result);
                    } else {
                        PageComparisonResult result = PageComparisonResult.onlyInB(idxB);
                        slots.add(() -> result);
                    }
                }
            } else if (op.getTag() == DiffTag.DELETE) {
                for (int index = op.getAStart(); index < op.getAEnd(); index++) {
                    PageComparisonResult result = PageComparisonResult.onlyInA(index);
                    slots.add(() -> result);
                }
            } else {
                for (int index = op.getBStart(); index < op.getBEnd(); index++) {
                    PageComparisonResult result = PageComparisonResult.onlyInB(index);
                    slots.add(() -> result);
                }
            }
        }

        List<PageComparisonResult> results = new ArrayList<>(slots.size());
        for (Supplier<PageComparisonResult> slot : slots) {
            results.add(slot.get());
        }
        log.debug("Planned {} report pages from {} alignment operations", results.size(), alignment.size());
        return results;
    }

    /**
     * Words are always fetched on the calling thread since page sources such as an open
     * PDF document are not thread-safe. Only the diff and the mapping may run elsewhere.
     */
    private Supplier<PageComparisonResult> pairSlot(int idxA, int idxB, WordLookup wordLookup,
                                                    PageLayout layout, boolean parallel) {
        List<Word> wordsA = wordLookup.wordsFor(Side.A, idxA);
        List<Word> wordsB = wordLookup.wordsFor(Side.B, idxB);
        if (!parallel) {
            PageComparisonResult result = comparePair(idxA, idxB, wordsA, wordsB, layout);
            return () -> result;
        }
        CompletableFuture<PageComparisonResult> future = CompletableFuture.supplyAsync(
                () -> comparePair(idxA, idxB, wordsA, wordsB, layout), pageDiffExecutor);
        return () -> {
            try {
                return future.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw e;
            }
        };
    }

    /**
     * Diff one matched page pair and map its changed words into the layout.
     */
    PageComparisonResult comparePair(int idxA, int idxB, List<Word> wordsA, List<Word> wordsB, PageLayout layout) {
        PageTransform transformA = layout.transformFor(Side.A, idxA, idxB);
        PageTransform transformB = layout.transformFor(Side.B, idxB, idxA);

        List<HighlightRegion> regions = new ArrayList<>();
        for (WordDiffOp op : wordDiffer.diffWords(wordsA, wordsB)) {
            if (op.getTag() == DiffTag.EQUAL) {
                continue;
            }
            if (op.removesWords()) {
                for (int w = op.getAStart(); w < op.getAEnd(); w++) {
                    regions.add(new HighlightRegion(Side.A,
                            coordinateMapper.map(wordsA.get(w).getBbox(), transformA), HighlightKind.REMOVED));
                }
            }
            if (op.addsWords()) {
                for (int w = op.getBStart(); w < op.getBEnd(); w++) {
                    regions.add(new HighlightRegion(Side.B,
                            coordinateMapper.map(wordsB.get(w).getBbox(), transformB), HighlightKind.ADDED));
                }
            }
        }

        PageComparisonResult result = PageComparisonResult.pair(idxA, idxB, regions);
        log.debug("A[{}] vs B[{}]: {} highlighted words{}", idxA, idxB, regions.size(),
                result.isShifted() ? ", shifted" : "");
        return result;
    }
}
