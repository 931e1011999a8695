package guraa.pdfdiff.extraction;

import guraa.pdfdiff.model.BoundingBox;
import guraa.pdfdiff.model.Word;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Text stripper that splits the glyph stream on whitespace and records each word with
 * the union of its glyph boxes.
 *
 * Boxes use the direction-adjusted coordinates of {@link TextPosition}: origin at the
 * top-left of the page, y growing downward, top edge at baseline minus glyph height.
 */
class WordCollectingStripper extends PDFTextStripper {

    private final List<Word> words = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();
    private double x0;
    private double y0;
    private double x1;
    private double y1;

    WordCollectingStripper() throws IOException {
        super();
        setSortByPosition(true);
    }

    List<Word> getWords() {
        return words;
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        for (TextPosition position : textPositions) {
            String unicode = position.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                flush();
            } else {
                append(position, unicode);
            }
        }
        // writeString is called once per word or line chunk, so a word never spans calls
        flush();
        super.writeString(text, textPositions);
    }

    private void append(TextPosition position, String unicode) {
        double left = position.getXDirAdj();
        double right = left + position.getWidthDirAdj();
        double bottom = position.getYDirAdj();
        double top = bottom - position.getHeightDir();
        if (current.length() == 0) {
            x0 = left;
            y0 = top;
            x1 = right;
            y1 = bottom;
        } else {
            x0 = Math.min(x0, left);
            y0 = Math.min(y0, top);
            x1 = Math.max(x1, right);
            y1 = Math.max(y1, bottom);
        }
        current.append(unicode);
    }

    private void flush() {
        if (current.length() > 0) {
            words.add(new Word(current.toString(), BoundingBox.of(x0, y0, x1, y1)));
            current.setLength(0);
        }
    }
}
