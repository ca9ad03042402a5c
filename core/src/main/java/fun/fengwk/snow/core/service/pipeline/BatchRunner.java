package fun.fengwk.snow.core.service.pipeline;

import fun.fengwk.snow.core.model.FailureKind;
import fun.fengwk.snow.core.model.ItemOutcome;
import fun.fengwk.snow.core.model.PageContent;
import fun.fengwk.snow.core.service.extract.SnowReportExtractor;
import fun.fengwk.snow.core.service.extract.model.ExtractionBatch;
import fun.fengwk.snow.core.service.fetch.FetchSession;
import fun.fengwk.snow.core.service.fetch.PageFetchService;
import fun.fengwk.snow.core.service.fetch.model.FetchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs one batch of urls: concurrent fetch in a single browser session, then extraction in paced
 * sub-batches. Every input url yields exactly one outcome and nothing is thrown.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchRunner {

    private final PageFetchService pageFetchService;
    private final SnowReportExtractor snowReportExtractor;
    private final PipelineProperties pipelineProperties;
    private final PacingSleeper pacingSleeper;

    /**
     * @return extraction outcomes in fetch order, followed by fetch failures in input order
     */
    public List<ItemOutcome> run(List<String> batchUrls) {
        if (batchUrls == null || batchUrls.isEmpty()) {
            return List.of();
        }

        List<FetchResult> fetchResults = fetchAll(batchUrls);
        List<PageContent> pages = new ArrayList<>();
        List<ItemOutcome> fetchFailures = new ArrayList<>();
        for (FetchResult result : fetchResults) {
            if (result.isSuccess()) {
                log.info("fetched page, url={}", result.getUrl());
                pages.add(new PageContent(result.getUrl(), result.getHtml()));
            } else {
                log.warn("fetch failed, url={}, error={}", result.getUrl(), result.getErrorMessage());
                fetchFailures.add(ItemOutcome.failure(result.getUrl(), FailureKind.FETCH, result.getErrorMessage()));
            }
        }

        List<ItemOutcome> outcomes = new ArrayList<>(batchUrls.size());
        outcomes.addAll(extractInSubBatches(pages));
        outcomes.addAll(fetchFailures);
        return outcomes;
    }

    private List<FetchResult> fetchAll(List<String> urls) {
        try (FetchSession session = pageFetchService.openSession(urls.size())) {
            List<CompletableFuture<FetchResult>> futures = new ArrayList<>(urls.size());
            for (String url : urls) {
                futures.add(session.fetch(url));
            }
            List<FetchResult> results = new ArrayList<>(urls.size());
            for (int i = 0; i < urls.size(); i++) {
                results.add(await(urls.get(i), futures.get(i)));
            }
            return results;
        } catch (RuntimeException ex) {
            log.error("browser session failed, urls={}, error={}", urls, ex.getMessage(), ex);
            String message = "browser session failed: " + ex.getMessage();
            List<FetchResult> results = new ArrayList<>(urls.size());
            for (String url : urls) {
                results.add(FetchResult.failed(url, message));
            }
            return results;
        }
    }

    private FetchResult await(String url, CompletableFuture<FetchResult> future) {
        try {
            FetchResult result = future == null ? null : future.join();
            return result == null ? FetchResult.failed(url, "no fetch result") : result;
        } catch (CompletionException | CancellationException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            return FetchResult.failed(url, cause.getMessage());
        }
    }

    private List<ItemOutcome> extractInSubBatches(List<PageContent> pages) {
        List<ItemOutcome> outcomes = new ArrayList<>(pages.size());
        int subBatchSize = pipelineProperties.resolveExtractionSubBatchSize();
        for (int from = 0; from < pages.size(); from += subBatchSize) {
            List<PageContent> subBatch = pages.subList(from, Math.min(from + subBatchSize, pages.size()));
            ExtractionBatch batch = extract(subBatch);
            if (!batch.isDispatched()) {
                log.error("extraction dispatch failed, urls={}, error={}", urlsOf(subBatch), batch.getDispatchError());
            }
            for (ItemOutcome outcome : batch.getOutcomes()) {
                if (outcome.isSuccess()) {
                    log.info("extracted report, url={}, resort={}", outcome.getUrl(), outcome.getReport().getResortName());
                } else {
                    log.warn("extraction failed, url={}, kind={}, error={}",
                        outcome.getUrl(), outcome.getFailure().getKind(), outcome.getFailure().getMessage());
                }
            }
            outcomes.addAll(batch.getOutcomes());

            if (from + subBatchSize < pages.size()) {
                pacingSleeper.sleep(Duration.ofMillis(pipelineProperties.getSubBatchDelayMs()));
            }
        }
        return outcomes;
    }

    private ExtractionBatch extract(List<PageContent> subBatch) {
        ExtractionBatch batch;
        try {
            batch = snowReportExtractor.extract(subBatch);
        } catch (RuntimeException ex) {
            return ExtractionBatch.dispatchFailed(subBatch, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
        if (batch == null || batch.getOutcomes().size() != subBatch.size()) {
            return ExtractionBatch.dispatchFailed(subBatch, "extractor returned a mismatched batch");
        }
        return batch;
    }

    private static List<String> urlsOf(List<PageContent> pages) {
        List<String> urls = new ArrayList<>(pages.size());
        for (PageContent page : pages) {
            urls.add(page.getUrl());
        }
        return urls;
    }

}
