package guraa.pdfdiff.layout;

import guraa.pdfdiff.config.PdfDiffProperties;
import guraa.pdfdiff.model.PageDimensions;
import guraa.pdfdiff.util.CoordinateMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the configured output layout for a pair of documents.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageLayoutFactory {

    private final PdfDiffProperties properties;
    private final CoordinateMapper coordinateMapper;

    /**
     * Create a layout for two documents.
     *
     * @param pagesA Native page sizes of document A
     * @param pagesB Native page sizes of document B
     * @return The layout selected by {@code pdfdiff.layout.mode}
     */
    public PageLayout create(List<PageDimensions> pagesA, List<PageDimensions> pagesB) {
        PdfDiffProperties.Layout config = properties.getLayout();
        log.debug("Creating {} layout for {} and {} pages", config.getMode(), pagesA.size(), pagesB.size());
        switch (config.getMode()) {
            case RASTER:
                return new RasterSideBySideLayout(pagesA, pagesB, config.getDpi(), coordinateMapper);
            case VECTOR:
            default:
                return new VectorSideBySideLayout(pagesA, pagesB,
                        config.getMargin(), config.getGap(), config.getLabelHeight());
        }
    }
}
