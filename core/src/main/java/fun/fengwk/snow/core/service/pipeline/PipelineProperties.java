package fun.fengwk.snow.core.service.pipeline;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Batch pipeline configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "snow.pipeline")
public class PipelineProperties {

    /**
     * Location of the url list, a spring resource location or a plain file path.
     */
    private String urlListLocation = "file:USACANADA.txt";

    /**
     * Urls fetched together in one browser session.
     */
    private int batchSize = 3;

    /**
     * Pages extracted concurrently, never more than {@link #batchSize}.
     */
    private int extractionSubBatchSize = 3;

    /**
     * Pause between extraction sub-batches of one batch, in milliseconds.
     */
    private long subBatchDelayMs = 1000;

    /**
     * Pause between batches, in milliseconds.
     */
    private long batchDelayMs = 2000;

    /**
     * Table the reports are written to.
     */
    private String table = "onthesnow";

    /**
     * Run the pipeline once when the application starts.
     */
    private boolean runOnStartup = true;

    /**
     * Refuse to start a run when completion or store credentials are missing.
     */
    private boolean requireCredentials = true;

    public int resolveBatchSize() {
        return Math.max(1, batchSize);
    }

    public int resolveExtractionSubBatchSize() {
        return Math.max(1, Math.min(extractionSubBatchSize, resolveBatchSize()));
    }

}
