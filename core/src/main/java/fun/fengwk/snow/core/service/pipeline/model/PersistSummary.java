package fun.fengwk.snow.core.service.pipeline.model;

import lombok.Value;

/**
 * Counts of one persist call.
 *
 * @author fengwk
 */
@Value
public class PersistSummary {

    int saved;
    int skipped;
    int failed;

}
