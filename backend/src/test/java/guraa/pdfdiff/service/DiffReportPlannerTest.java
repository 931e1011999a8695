package guraa.pdfdiff.service;

import guraa.pdfdiff.config.PdfDiffProperties;
import guraa.pdfdiff.core.WordDiffer;
import guraa.pdfdiff.layout.PageLayout;
import guraa.pdfdiff.layout.VectorSideBySideLayout;
import guraa.pdfdiff.model.AlignmentOp;
import guraa.pdfdiff.model.AlignmentPlan;
import guraa.pdfdiff.model.BoundingBox;
import guraa.pdfdiff.model.HighlightKind;
import guraa.pdfdiff.model.HighlightRegion;
import guraa.pdfdiff.model.PageComparisonResult;
import guraa.pdfdiff.model.PageDimensions;
import guraa.pdfdiff.model.PageStatus;
import guraa.pdfdiff.model.Side;
import guraa.pdfdiff.model.Word;
import guraa.pdfdiff.util.CoordinateMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DiffReportPlannerTest {

    private static final Word HELLO = Word.of("Hello", 10, 10, 40, 20);
    private static final Word WORLD = Word.of("World", 45, 10, 80, 20);

    private final CoordinateMapper mapper = new CoordinateMapper();
    private PdfDiffProperties properties;
    private DiffReportPlanner planner;

    @BeforeEach
    void setUp() {
        properties = new PdfDiffProperties();
        planner = new DiffReportPlanner(new WordDiffer(), mapper, properties, Runnable::run);
    }

    @Test
    void testInsertedPageProducesShiftedPair() {
        AlignmentPlan plan = new AlignmentPlan(Arrays.asList(
                AlignmentOp.equal(0, 1, 0, 1),
                AlignmentOp.insert(1, 1, 2),
                AlignmentOp.equal(1, 2, 2, 3)), 2, 3);
        WordLookup words = (side, pageIndex) -> Collections.singletonList(HELLO);

        List<PageComparisonResult> results = planner.plan(plan, words, PageLayout.identity());

        assertEquals(Arrays.asList(
                PageComparisonResult.pair(0, 0, Collections.emptyList()),
                PageComparisonResult.onlyInB(1),
                PageComparisonResult.pair(1, 2, Collections.emptyList())), results);
        assertEquals(PageStatus.SHIFTED, results.get(2).getStatus());
    }

    @Test
    void testAddedWordIsHighlightedOnPageB() {
        PageLayout layout = new VectorSideBySideLayout(
                Collections.singletonList(PageDimensions.LETTER),
                Collections.singletonList(PageDimensions.LETTER), 20, 10, 40);

        PageComparisonResult result = planner.comparePair(0, 0,
                Collections.singletonList(HELLO), Arrays.asList(HELLO, WORLD), layout);

        BoundingBox expected = mapper.map(WORLD.getBbox(), layout.transformFor(Side.B, 0, 0));
        assertEquals(Collections.singletonList(new HighlightRegion(Side.B, expected, HighlightKind.ADDED)),
                result.getRegions());
        assertEquals(BoundingBox.of(20 + 612 + 10 + 45, 70, 20 + 612 + 10 + 80, 80), expected);
        assertEquals(PageStatus.CHANGED, result.getStatus());
    }

    @Test
    void testReplacedWordsAreHighlightedOnBothSides() {
        Word brave = Word.of("brave", 45, 10, 75, 20);

        PageComparisonResult result = planner.comparePair(2, 2,
                Arrays.asList(HELLO, WORLD), Arrays.asList(HELLO, brave), PageLayout.identity());

        assertEquals(Arrays.asList(
                new HighlightRegion(Side.A, WORLD.getBbox(), HighlightKind.REMOVED),
                new HighlightRegion(Side.B, brave.getBbox(), HighlightKind.ADDED)), result.getRegions());
    }

    @Test
    void testSingletonsNeverFetchWords() {
        WordLookup words = mock(WordLookup.class);
        when(words.wordsFor(eq(Side.A), anyInt())).thenReturn(Collections.singletonList(HELLO));
        when(words.wordsFor(eq(Side.B), anyInt())).thenReturn(Collections.singletonList(HELLO));
        AlignmentPlan plan = new AlignmentPlan(Arrays.asList(
                AlignmentOp.delete(0, 2, 0),
                AlignmentOp.replace(2, 3, 0, 1),
                AlignmentOp.insert(3, 1, 3)), 3, 3);

        List<PageComparisonResult> results = planner.plan(plan, words, PageLayout.identity());

        assertEquals(Arrays.asList(
                PageComparisonResult.onlyInA(0),
                PageComparisonResult.onlyInA(1),
                PageComparisonResult.pair(2, 0, Collections.emptyList()),
                PageComparisonResult.onlyInB(1),
                PageComparisonResult.onlyInB(2)), results);
        verify(words, times(1)).wordsFor(Side.A, 2);
        verify(words, times(1)).wordsFor(Side.B, 0);
        verify(words, never()).wordsFor(Side.A, 0);
        verify(words, never()).wordsFor(Side.B, 1);
        verify(words, never()).wordsFor(Side.B, 2);
    }

    @Test
    void testUnbalancedEqualOperationEmitsLeftoverPages() {
        // Not produced by the aligner, but any source of plans may hand one in
        AlignmentPlan plan = new AlignmentPlan(
                Collections.singletonList(AlignmentOp.equal(0, 3, 0, 1)), 3, 1);

        List<PageComparisonResult> results = planner.plan(plan,
                (side, pageIndex) -> Collections.singletonList(HELLO), PageLayout.identity());

        assertEquals(Arrays.asList(
                PageComparisonResult.pair(0, 0, Collections.emptyList()),
                PageComparisonResult.onlyInA(1),
                PageComparisonResult.onlyInA(2)), results);
    }

    @Test
    void testParallelPlanningKeepsOrderAndResults() {
        AlignmentPlan plan = new AlignmentPlan(Arrays.asList(
                AlignmentOp.equal(0, 4, 0, 4),
                AlignmentOp.insert(4, 4, 5),
                AlignmentOp.replace(4, 6, 5, 7)), 6, 7);
        WordLookup words = (side, pageIndex) -> side == Side.A || pageIndex % 2 == 0
                ? Collections.singletonList(HELLO)
                : Arrays.asList(HELLO, WORLD);

        List<PageComparisonResult> sequential = planner.plan(plan, words, PageLayout.identity());

        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            properties.getPlanner().setParallel(true);
            DiffReportPlanner parallelPlanner = new DiffReportPlanner(new WordDiffer(), mapper, properties, executor);

            assertEquals(sequential, parallelPlanner.plan(plan, words, PageLayout.identity()));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(7, sequential.size());
        assertEquals(PageStatus.CHANGED, sequential.get(1).getStatus());
        assertEquals(PageStatus.ADDED, sequential.get(4).getStatus());
    }

    @Test
    void testEmptyPlan() {
        assertTrue(planner.plan(AlignmentPlan.empty(),
                (side, pageIndex) -> Collections.emptyList(), PageLayout.identity()).isEmpty());
    }
}
