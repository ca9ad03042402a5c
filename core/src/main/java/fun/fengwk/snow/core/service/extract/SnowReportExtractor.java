package fun.fengwk.snow.core.service.extract;

import fun.fengwk.snow.core.model.PageContent;
import fun.fengwk.snow.core.service.extract.model.ExtractionBatch;

import java.util.List;

/**
 * @author fengwk
 */
public interface SnowReportExtractor {

    /**
     * Extract one report per page with concurrent completion calls, waiting for all of them.
     * Never throws: failures are outcomes of the returned batch.
     */
    ExtractionBatch extract(List<PageContent> pages);

}
