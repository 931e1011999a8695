package guraa.pdfdiff.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the comparison engine.
 */
@Component
@ConfigurationProperties(prefix = "pdfdiff")
public class PdfDiffProperties {

    private final Alignment alignment = new Alignment();
    private final Similarity similarity = new Similarity();
    private final Layout layout = new Layout();
    private final Planner planner = new Planner();

    public Alignment getAlignment() {
        return alignment;
    }

    public Similarity getSimilarity() {
        return similarity;
    }

    public Layout getLayout() {
        return layout;
    }

    public Planner getPlanner() {
        return planner;
    }

    /**
     * Page alignment properties
     */
    public static class Alignment {
        /**
         * Pages scoring above this are considered the same page.
         */
        private double similarityThreshold = 0.6;

        /**
         * Exclusive bound on how many pages ahead the aligner probes for an inserted or
         * deleted run.
         */
        private int lookaheadWindow = 3;

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getLookaheadWindow() {
            return lookaheadWindow;
        }

        public void setLookaheadWindow(int lookaheadWindow) {
            this.lookaheadWindow = lookaheadWindow;
        }
    }

    /**
     * Similarity scoring properties
     */
    public static class Similarity {
        private boolean autojunk = false;

        public boolean isAutojunk() {
            return autojunk;
        }

        public void setAutojunk(boolean autojunk) {
            this.autojunk = autojunk;
        }
    }

    /**
     * Output layout properties
     */
    public static class Layout {
        private LayoutMode mode = LayoutMode.VECTOR;
        private double margin = 20;
        private double gap = 10;
        private double labelHeight = 40;
        private int dpi = 75;

        public LayoutMode getMode() {
            return mode;
        }

        public void setMode(LayoutMode mode) {
            this.mode = mode;
        }

        public double getMargin() {
            return margin;
        }

        public void setMargin(double margin) {
            this.margin = margin;
        }

        public double getGap() {
            return gap;
        }

        public void setGap(double gap) {
            this.gap = gap;
        }

        public double getLabelHeight() {
            return labelHeight;
        }

        public void setLabelHeight(double labelHeight) {
            this.labelHeight = labelHeight;
        }

        public int getDpi() {
            return dpi;
        }

        public void setDpi(int dpi) {
            this.dpi = dpi;
        }
    }

    /**
     * Report planning properties
     */
    public static class Planner {
        /**
         * Diff matched page pairs on the page diff executor instead of the calling thread.
         */
        private boolean parallel = false;

        public boolean isParallel() {
            return parallel;
        }

        public void setParallel(boolean parallel) {
            this.parallel = parallel;
        }
    }

    public enum LayoutMode {
        /** Pages copied at native size with margins, a gap and a label strip. */
        VECTOR,
        /** Pages rasterized at the configured DPI and placed edge to edge. */
        RASTER
    }
}
