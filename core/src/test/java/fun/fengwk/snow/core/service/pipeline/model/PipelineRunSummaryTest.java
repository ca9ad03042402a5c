package fun.fengwk.snow.core.service.pipeline.model;

import fun.fengwk.snow.core.model.FailureKind;
import fun.fengwk.snow.core.model.ItemOutcome;
import fun.fengwk.snow.core.model.SnowReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class PipelineRunSummaryTest {

    @Test
    public void shouldCountOutcomesByKindAndRetryability() {
        PipelineRunSummary summary = PipelineRunSummary.builder().runId("r1").build();

        summary.recordBatch(List.of(
            ItemOutcome.success("https://s/a", SnowReport.builder().resortName("a").build()),
            ItemOutcome.failure("https://s/b", FailureKind.FETCH, "timeout"),
            ItemOutcome.failure("https://s/c", FailureKind.EXTRACTION_PARSE, "invalid report json"),
            ItemOutcome.failure("https://s/d", FailureKind.EXTRACTION_DISPATCH, "status 503")
        ), new PersistSummary(1, 3, 0));

        assertThat(summary.getCompletedBatches()).isEqualTo(1);
        assertThat(summary.getOutcomes()).isEqualTo(4);
        assertThat(summary.getExtracted()).isEqualTo(1);
        assertThat(summary.getFailures()).isEqualTo(3);
        assertThat(summary.getRetryableFailures()).isEqualTo(2);
        assertThat(summary.getSaved()).isEqualTo(1);
        assertThat(summary.getSkipped()).isEqualTo(3);
    }

}
