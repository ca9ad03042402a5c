package fun.fengwk.snow.core.service.extract.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.snow.core.facade.completion.CompletionFacade;
import fun.fengwk.snow.core.facade.completion.model.CompletionRequest;
import fun.fengwk.snow.core.facade.completion.model.CompletionResponse;
import fun.fengwk.snow.core.model.FailureKind;
import fun.fengwk.snow.core.model.ItemOutcome;
import fun.fengwk.snow.core.model.PageContent;
import fun.fengwk.snow.core.model.SnowReport;
import fun.fengwk.snow.core.service.extract.ExtractProperties;
import fun.fengwk.snow.core.service.extract.SnowReportExtractor;
import fun.fengwk.snow.core.service.extract.model.ExtractionBatch;
import fun.fengwk.snow.core.service.extract.parser.ReportContentSelector;
import fun.fengwk.snow.core.service.extract.prompt.ExtractionPromptRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Snow report extractor backed by a json-mode completion backend.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class SnowReportExtractorImpl implements SnowReportExtractor {

    private final CompletionFacade completionFacade;
    private final ReportContentSelector reportContentSelector;
    private final ExtractionPromptRenderer promptRenderer;
    private final ExtractProperties extractProperties;
    private final ObjectMapper objectMapper;
    private final ExecutorService extractionExecutor;

    public SnowReportExtractorImpl(
        CompletionFacade completionFacade,
        ReportContentSelector reportContentSelector,
        ExtractionPromptRenderer promptRenderer,
        ExtractProperties extractProperties,
        ObjectMapper objectMapper,
        @Qualifier("extractionExecutor") ExecutorService extractionExecutor
    ) {
        this.completionFacade = completionFacade;
        this.reportContentSelector = reportContentSelector;
        this.promptRenderer = promptRenderer;
        this.extractProperties = extractProperties;
        this.objectMapper = objectMapper;
        this.extractionExecutor = extractionExecutor;
    }

    @Override
    public ExtractionBatch extract(List<PageContent> pages) {
        if (pages == null || pages.isEmpty()) {
            return ExtractionBatch.completed(List.of());
        }

        try {
            List<CompletionRequest> requests = new ArrayList<>(pages.size());
            for (PageContent page : pages) {
                requests.add(buildRequest(page));
            }

            List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>(pages.size());
            for (int i = 0; i < pages.size(); i++) {
                PageContent page = pages.get(i);
                CompletionRequest request = requests.get(i);
                futures.add(CompletableFuture
                    .supplyAsync(() -> completionFacade.complete(request), extractionExecutor)
                    .handle((response, ex) -> toOutcome(page, response, ex)));
            }

            // No early return: every request of the sub-batch settles before results are read.
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            List<ItemOutcome> outcomes = new ArrayList<>(futures.size());
            for (CompletableFuture<ItemOutcome> future : futures) {
                outcomes.add(future.join());
            }
            return ExtractionBatch.completed(outcomes);
        } catch (Exception ex) {
            String error = describe(ex);
            log.warn("extraction sub-batch dispatch failed, size={}, error={}", pages.size(), error, ex);
            return ExtractionBatch.dispatchFailed(pages, error);
        }
    }

    private CompletionRequest buildRequest(PageContent page) {
        String content = reportContentSelector.select(page.getHtml());
        return CompletionRequest.builder()
            .systemPrompt(extractProperties.getSystemPrompt())
            .userPrompt(promptRenderer.render(content))
            .responseFormat(CompletionRequest.FORMAT_JSON_OBJECT)
            .build();
    }

    private ItemOutcome toOutcome(PageContent page, CompletionResponse response, Throwable ex) {
        String url = page.getUrl();
        if (ex != null) {
            String error = describe(ex);
            log.warn("extraction request failed, url={}, error={}", url, error);
            return ItemOutcome.failure(url, FailureKind.EXTRACTION_DISPATCH, error);
        }
        if (response == null) {
            return ItemOutcome.failure(url, FailureKind.EXTRACTION_DISPATCH, "completion response is null");
        }
        if (!response.isDelivered()) {
            log.warn("extraction request not delivered, url={}, status={}, error={}", url, response.getStatusCode(), response.getError());
            return ItemOutcome.failure(url, FailureKind.EXTRACTION_DISPATCH, response.getError());
        }
        if (response.getError() != null) {
            log.warn("extraction response unreadable, url={}, error={}", url, response.getError());
            return ItemOutcome.failure(url, FailureKind.EXTRACTION_PARSE, response.getError());
        }

        try {
            return ItemOutcome.success(url, parseReport(response.getContent()));
        } catch (Exception parseEx) {
            log.warn("error processing completion response, url={}, error={}", url, parseEx.getMessage());
            return ItemOutcome.failure(url, FailureKind.EXTRACTION_PARSE, "invalid report json: " + parseEx.getMessage());
        }
    }

    private SnowReport parseReport(String content) throws Exception {
        if (!StringUtils.hasText(content)) {
            throw new IllegalArgumentException("empty content");
        }
        JsonNode root = objectMapper.readTree(content);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("content is not a json object");
        }
        return objectMapper.treeToValue(root, SnowReport.class);
    }

    private static String describe(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return StringUtils.hasText(cause.getMessage())
            ? cause.getMessage()
            : cause.getClass().getSimpleName();
    }

}
