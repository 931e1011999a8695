package guraa.pdfdiff.service;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import guraa.pdfdiff.model.PageText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Line-based unified diff over the full text of two documents.
 */
@Slf4j
@Service
public class TextDiffService {

    static final String HEADER_A = "PDF A";
    static final String HEADER_B = "PDF B";
    private static final int CONTEXT_LINES = 3;

    /**
     * Join each document's pages with newlines and diff the resulting lines.
     *
     * @param textA Pages of document A
     * @param textB Pages of document B
     * @return Unified diff lines, empty if the texts are identical
     */
    public List<String> unifiedDiff(List<PageText> textA, List<PageText> textB) {
        List<String> linesA = lines(textA);
        List<String> linesB = lines(textB);

        Patch<String> patch = DiffUtils.diff(linesA, linesB);
        if (patch.getDeltas().isEmpty()) {
            return Collections.emptyList();
        }
        List<String> diff = UnifiedDiffUtils.generateUnifiedDiff(HEADER_A, HEADER_B, linesA, patch, CONTEXT_LINES);
        log.debug("Text diff has {} changed blocks in {} lines", patch.getDeltas().size(), diff.size());
        return diff;
    }

    private static List<String> lines(List<PageText> pages) {
        String joined = pages.stream().map(PageText::getContent).collect(Collectors.joining("\n"));
        return joined.lines().collect(Collectors.toList());
    }
}
