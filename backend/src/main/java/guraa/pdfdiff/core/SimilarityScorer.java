package guraa.pdfdiff.core;

import guraa.pdfdiff.config.PdfDiffProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Computes Ratcliff-Obershelp similarity ratios between token sequences.
 *
 * The ratio is {@code 2 * matched / (len(a) + len(b))}, where matched counts the tokens
 * in the recursive longest-common-block matching. Near-duplicate pages score close to
 * 1.0, unrelated ones close to 0.0, which is what the page alignment threshold expects.
 *
 * <p>The plain matcher is not symmetric: which block wins a tie depends on argument
 * order. Arguments are therefore put in a canonical order first (shorter sequence
 * first, equal lengths ordered by element hash codes), so {@code ratio(a, b) == ratio(b, a)}.
 * When the hash codes cannot tell two different lists apart, both orders are scored and
 * the higher ratio wins.
 */
@Component
public class SimilarityScorer {

    private final boolean autojunk;

    /**
     * Create a scorer without popular-element pruning.
     */
    public SimilarityScorer() {
        this(false);
    }

    public SimilarityScorer(boolean autojunk) {
        this.autojunk = autojunk;
    }

    @Autowired
    public SimilarityScorer(PdfDiffProperties properties) {
        this(properties.getSimilarity().isAutojunk());
    }

    /**
     * Similarity of two token sequences.
     *
     * @param a First sequence
     * @param b Second sequence
     * @return Ratio in [0, 1]; 1.0 for identical sequences, including two empty ones
     */
    public <T> double ratio(List<T> a, List<T> b) {
        int order = canonicalOrder(a, b);
        if (order > 0) {
            return new SequenceMatcher<>(b, a, autojunk).ratio();
        }
        if (order == 0 && !a.equals(b)) {
            // Hash codes collide at every position, so neither order is canonical
            return Math.max(new SequenceMatcher<>(a, b, autojunk).ratio(),
                    new SequenceMatcher<>(b, a, autojunk).ratio());
        }
        return new SequenceMatcher<>(a, b, autojunk).ratio();
    }

    /**
     * Character-level similarity of two strings. Characters are compared as Unicode code
     * points, so a surrogate pair counts as one token.
     *
     * @param a First text
     * @param b Second text
     * @return Ratio in [0, 1]
     */
    public double ratio(String a, String b) {
        return ratio(codePoints(a), codePoints(b));
    }

    public boolean isAutojunk() {
        return autojunk;
    }

    /**
     * Positive if {@code b} should be matched first, negative if {@code a} should, zero if
     * the lists have equal length and equal element hash codes throughout.
     */
    private static <T> int canonicalOrder(List<T> a, List<T> b) {
        if (a.size() != b.size()) {
            return Integer.compare(a.size(), b.size());
        }
        for (int i = 0; i < a.size(); i++) {
            int order = Integer.compare(Objects.hashCode(a.get(i)), Objects.hashCode(b.get(i)));
            if (order != 0) {
                return order;
            }
        }
        return 0;
    }

    private static List<Integer> codePoints(String text) {
        return text.codePoints().boxed().collect(Collectors.toList());
    }
}
