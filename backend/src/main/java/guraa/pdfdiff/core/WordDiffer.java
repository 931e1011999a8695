package guraa.pdfdiff.core;

import guraa.pdfdiff.config.PdfDiffProperties;
import guraa.pdfdiff.model.Word;
import guraa.pdfdiff.model.WordDiffOp;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Word-level diff of two pages. Only the word texts are compared.
 *
 * <p>With {@code pdfdiff.similarity.autojunk} enabled, words that are very frequent on a
 * long page (200 words or more) do not anchor matches, as with page similarity scoring.
 */
@Component
public class WordDiffer {

    private final boolean autojunk;

    public WordDiffer() {
        this(false);
    }

    public WordDiffer(boolean autojunk) {
        this.autojunk = autojunk;
    }

    @Autowired
    public WordDiffer(PdfDiffProperties properties) {
        this(properties.getSimilarity().isAutojunk());
    }

    /**
     * Compute the edit script between the words of two pages.
     *
     * @param wordsA Words of the page in document A, in reading order
     * @param wordsB Words of the page in document B, in reading order
     * @return Opcodes whose ranges tile both word lists; empty when both lists are empty
     */
    public List<WordDiffOp> diffWords(List<Word> wordsA, List<Word> wordsB) {
        SequenceMatcher<String> matcher = new SequenceMatcher<>(texts(wordsA), texts(wordsB), autojunk);
        return matcher.getOpcodes().stream()
                .map(op -> new WordDiffOp(op.getTag(), op.getAStart(), op.getAEnd(), op.getBStart(), op.getBEnd()))
                .collect(Collectors.toList());
    }

    public boolean isAutojunk() {
        return autojunk;
    }

    private static List<String> texts(List<Word> words) {
        return words.stream().map(Word::getText).collect(Collectors.toList());
    }
}
