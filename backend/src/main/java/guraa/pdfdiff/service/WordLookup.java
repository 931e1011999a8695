package guraa.pdfdiff.service;

import guraa.pdfdiff.model.Side;
import guraa.pdfdiff.model.Word;

import java.util.List;

/**
 * Supplies the words of a page, in reading order.
 */
@FunctionalInterface
public interface WordLookup {

    List<Word> wordsFor(Side side, int pageIndex);
}
