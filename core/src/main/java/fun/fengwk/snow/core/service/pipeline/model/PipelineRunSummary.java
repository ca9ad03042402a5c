package fun.fengwk.snow.core.service.pipeline.model;

import fun.fengwk.snow.core.model.ItemOutcome;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Progress and result of one pipeline run.
 *
 * @author fengwk
 */
@Data
@Builder
public class PipelineRunSummary {

    private String runId;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private int totalUrls;
    private int totalBatches;
    private int completedBatches;
    private int outcomes;
    private int extracted;
    private int fetchFailures;
    private int parseFailures;
    private int dispatchFailures;
    private int retryableFailures;
    private int saved;
    private int skipped;
    private int saveFailures;

    public void recordBatch(List<ItemOutcome> batchOutcomes, PersistSummary persistSummary) {
        completedBatches++;
        for (ItemOutcome outcome : batchOutcomes) {
            outcomes++;
            if (outcome.isSuccess()) {
                extracted++;
                continue;
            }
            if (outcome.getFailure().getKind().isTransient()) {
                retryableFailures++;
            }
            switch (outcome.getFailure().getKind()) {
                case FETCH:
                    fetchFailures++;
                    break;
                case EXTRACTION_PARSE:
                    parseFailures++;
                    break;
                case EXTRACTION_DISPATCH:
                    dispatchFailures++;
                    break;
                default:
                    throw new IllegalStateException("unknown failure kind: " + outcome.getFailure().getKind());
            }
        }
        saved += persistSummary.getSaved();
        skipped += persistSummary.getSkipped();
        saveFailures += persistSummary.getFailed();
    }

    public int getFailures() {
        return fetchFailures + parseFailures + dispatchFailures;
    }

    public Duration elapsed() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }

}
