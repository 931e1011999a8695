package guraa.pdfdiff.core;

import guraa.pdfdiff.config.PdfDiffProperties;
import guraa.pdfdiff.model.AlignmentOp;
import guraa.pdfdiff.model.AlignmentPlan;
import guraa.pdfdiff.model.DiffTag;
import guraa.pdfdiff.model.PageText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Aligns the pages of two documents by text similarity.
 *
 * <p>A greedy single forward pass with one cursor per document. At each step the current
 * pair is scored and a few pages ahead on either side are probed; if skipping pages of B
 * (an insertion) or of A (a deletion) yields a pair scoring above both the current pair
 * and the threshold, the skipped pages are emitted as inserted or deleted and only that
 * cursor moves. Otherwise the current pair is emitted as EQUAL or REPLACE and both
 * cursors move. This is not a globally optimal alignment; it handles small local
 * insertions and deletions in one pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageAligner {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.6;
    public static final int DEFAULT_LOOKAHEAD_WINDOW = 3;

    private final SimilarityScorer similarityScorer;
    private final PdfDiffProperties properties;

    /**
     * Align two documents using the configured threshold and look-ahead window.
     *
     * @param textA Pages of document A, in order
     * @param textB Pages of document B, in order
     * @return The alignment plan
     */
    public AlignmentPlan align(List<PageText> textA, List<PageText> textB) {
        PdfDiffProperties.Alignment config = properties.getAlignment();
        return align(textA, textB, config.getSimilarityThreshold(), config.getLookaheadWindow());
    }

    /**
     * Align two documents.
     *
     * @param textA               Pages of document A, in order
     * @param textB               Pages of document B, in order
     * @param similarityThreshold Pages must score strictly above this to count as equal, in [0, 1]
     * @param lookaheadWindow     Exclusive bound on the skip distance probed, at least 1;
     *                            a window of 1 disables insert and delete detection
     * @return The alignment plan covering every page of both documents
     */
    public AlignmentPlan align(List<PageText> textA, List<PageText> textB,
                               double similarityThreshold, int lookaheadWindow) {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be in [0, 1]: " + similarityThreshold);
        }
        if (lookaheadWindow < 1) {
            throw new IllegalArgumentException("Look-ahead window must be at least 1: " + lookaheadWindow);
        }

        int lenA = textA.size();
        int lenB = textB.size();
        List<AlignmentOp> operations = new ArrayList<>();
        int i = 0;
        int j = 0;

        while (i < lenA || j < lenB) {
            if (i >= lenA) {
                append(operations, AlignmentOp.insert(i, j, lenB));
                break;
            }
            if (j >= lenB) {
                append(operations, AlignmentOp.delete(i, lenA, j));
                break;
            }

            String pageA = textA.get(i).getContent();
            double current = similarityScorer.ratio(pageA, textB.get(j).getContent());

            DiffTag bestTag = DiffTag.EQUAL;
            double bestSimilarity = current;
            int bestSkip = 0;

            for (int skip = 1; skip < Math.min(lookaheadWindow, lenB - j); skip++) {
                double similarity = similarityScorer.ratio(pageA, textB.get(j + skip).getContent());
                if (similarity > bestSimilarity && similarity > similarityThreshold) {
                    bestTag = DiffTag.INSERT;
                    bestSimilarity = similarity;
                    bestSkip = skip;
                }
            }

            String pageB = textB.get(j).getContent();
            for (int skip = 1; skip < Math.min(lookaheadWindow, lenA - i); skip++) {
                double similarity = similarityScorer.ratio(textA.get(i + skip).getContent(), pageB);
                if (similarity > bestSimilarity && similarity > similarityThreshold) {
                    bestTag = DiffTag.DELETE;
                    bestSimilarity = similarity;
                    bestSkip = skip;
                }
            }

            if (bestTag == DiffTag.INSERT) {
                log.debug("A[{}] matches B[{}] ({}) better than B[{}] ({}): B pages {}..{} inserted",
                        i, j + bestSkip, bestSimilarity, j, current, j, j + bestSkip - 1);
                append(operations, AlignmentOp.insert(i, j, j + bestSkip));
                j += bestSkip;
            } else if (bestTag == DiffTag.DELETE) {
                log.debug("A[{}] matches B[{}] ({}) better than A[{}] ({}): A pages {}..{} deleted",
                        i + bestSkip, j, bestSimilarity, i, current, i, i + bestSkip - 1);
                append(operations, AlignmentOp.delete(i, i + bestSkip, j));
                i += bestSkip;
            } else {
                boolean equal = current > similarityThreshold;
                log.debug("A[{}] vs B[{}]: similarity {} -> {}", i, j, current, equal ? "equal" : "replace");
                append(operations, equal
                        ? AlignmentOp.equal(i, i + 1, j, j + 1)
                        : AlignmentOp.replace(i, i + 1, j, j + 1));
                i++;
                j++;
            }
        }

        AlignmentPlan plan = new AlignmentPlan(operations, lenA, lenB);
        log.debug("Aligned {} pages against {} pages into {} operations", lenA, lenB, plan.size());
        return plan;
    }

    /**
     * Add an operation, merging it into the previous one when both are EQUAL or both
     * REPLACE and the ranges are contiguous.
     */
    private static void append(List<AlignmentOp> operations, AlignmentOp op) {
        if (!operations.isEmpty()) {
            int last = operations.size() - 1;
            AlignmentOp previous = operations.get(last);
            boolean mergeable = op.getTag() == DiffTag.EQUAL || op.getTag() == DiffTag.REPLACE;
            if (mergeable && previous.getTag() == op.getTag()
                    && previous.getAEnd() == op.getAStart() && previous.getBEnd() == op.getBStart()) {
                operations.set(last, previous.extendWith(op));
                return;
            }
        }
        operations.add(op);
    }
}
