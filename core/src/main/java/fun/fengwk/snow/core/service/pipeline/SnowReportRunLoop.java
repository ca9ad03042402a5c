package fun.fengwk.snow.core.service.pipeline;

import fun.fengwk.snow.core.facade.completion.openai.OpenAiProperties;
import fun.fengwk.snow.core.facade.store.supabase.SupabaseProperties;
import fun.fengwk.snow.core.model.ItemOutcome;
import fun.fengwk.snow.core.service.pipeline.model.PersistSummary;
import fun.fengwk.snow.core.service.pipeline.model.PipelineRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives a whole run: load the url list, then process batches strictly in sequence with a fixed
 * pause after each batch, the last one included.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnowReportRunLoop {

    private final ReentrantLock runLock = new ReentrantLock();

    private final UrlListLoader urlListLoader;
    private final BatchRunner batchRunner;
    private final SnowReportPersister snowReportPersister;
    private final PipelineProperties pipelineProperties;
    private final OpenAiProperties openAiProperties;
    private final SupabaseProperties supabaseProperties;
    private final PacingSleeper pacingSleeper;

    /**
     * @throws IllegalStateException on setup faults or when another run is in progress
     */
    public PipelineRunSummary run() {
        if (!runLock.tryLock()) {
            throw new IllegalStateException("snow report run already in progress");
        }
        try {
            return doRun();
        } finally {
            runLock.unlock();
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    private PipelineRunSummary doRun() {
        validateCredentials();
        List<String> urls = urlListLoader.load(pipelineProperties.getUrlListLocation());

        int batchSize = pipelineProperties.resolveBatchSize();
        int totalBatches = (urls.size() + batchSize - 1) / batchSize;
        PipelineRunSummary summary = PipelineRunSummary.builder()
            .runId(UUID.randomUUID().toString())
            .startedAt(LocalDateTime.now())
            .totalUrls(urls.size())
            .totalBatches(totalBatches)
            .build();
        log.info("snow report run started, runId={}, urls={}, batches={}",
            summary.getRunId(), urls.size(), totalBatches);

        for (int from = 0, batchNo = 1; from < urls.size(); from += batchSize, batchNo++) {
            List<String> batch = new ArrayList<>(urls.subList(from, Math.min(from + batchSize, urls.size())));
            log.info("Processing batch {} of {}", batchNo, totalBatches);

            List<ItemOutcome> outcomes = batchRunner.run(batch);
            PersistSummary persistSummary = snowReportPersister.persist(outcomes);
            summary.recordBatch(outcomes, persistSummary);
            log.info("Completed batch {}, outcomes={}, saved={}, skipped={}, saveFailures={}",
                batchNo, outcomes.size(), persistSummary.getSaved(), persistSummary.getSkipped(),
                persistSummary.getFailed());

            pacingSleeper.sleep(Duration.ofMillis(pipelineProperties.getBatchDelayMs()));
        }

        summary.setCompletedAt(LocalDateTime.now());
        log.info("snow report run completed, runId={}, urls={}, extracted={}, fetchFailures={}, "
                + "parseFailures={}, dispatchFailures={}, retryableFailures={}, saved={}, skipped={}, saveFailures={}, elapsed={}",
            summary.getRunId(), summary.getTotalUrls(), summary.getExtracted(), summary.getFetchFailures(),
            summary.getParseFailures(), summary.getDispatchFailures(), summary.getRetryableFailures(), summary.getSaved(),
            summary.getSkipped(), summary.getSaveFailures(), summary.elapsed());
        return summary;
    }

    private void validateCredentials() {
        if (!pipelineProperties.isRequireCredentials()) {
            return;
        }
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(openAiProperties.getApiKey())) {
            missing.add("snow.completion.openai.api-key");
        }
        if (!StringUtils.hasText(supabaseProperties.getUrl())) {
            missing.add("snow.store.supabase.url");
        }
        if (!StringUtils.hasText(supabaseProperties.getServiceKey())) {
            missing.add("snow.store.supabase.service-key");
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("missing configuration: " + String.join(", ", missing));
        }
    }

}
