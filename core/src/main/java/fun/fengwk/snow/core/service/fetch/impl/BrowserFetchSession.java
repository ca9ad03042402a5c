package fun.fengwk.snow.core.service.fetch.impl;

import fun.fengwk.snow.core.service.browser.runtime.BrowserSession;
import fun.fengwk.snow.core.service.fetch.FetchProperties;
import fun.fengwk.snow.core.service.fetch.FetchSession;
import fun.fengwk.snow.core.service.fetch.model.FetchResult;
import fun.fengwk.snow.core.service.fetch.runtime.PageFetchTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Fetch session backed by one browser session.
 *
 * @author fengwk
 */
@Slf4j
public class BrowserFetchSession implements FetchSession {

    private final BrowserSession browserSession;
    private final FetchProperties fetchProperties;

    public BrowserFetchSession(BrowserSession browserSession, FetchProperties fetchProperties) {
        this.browserSession = browserSession;
        this.fetchProperties = fetchProperties;
    }

    @Override
    public CompletableFuture<FetchResult> fetch(String url) {
        String invalidReason = validateUrl(url);
        if (invalidReason != null) {
            return CompletableFuture.completedFuture(FetchResult.failed(url, invalidReason));
        }

        String normalizedUrl = url.trim();
        CompletableFuture<FetchResult> future;
        try {
            future = browserSession.submit(new PageFetchTask(normalizedUrl, fetchProperties));
        } catch (Exception ex) {
            return CompletableFuture.completedFuture(FetchResult.failed(url, describe(ex)));
        }
        return future.handle((result, ex) -> {
            if (ex != null) {
                return FetchResult.failed(url, describe(ex));
            }
            if (result == null) {
                return FetchResult.failed(url, "fetch result is null");
            }
            // Keep the caller's url so outcomes can be matched back to the input list.
            return result.isSuccess()
                ? FetchResult.ok(url, result.getHtml())
                : FetchResult.failed(url, result.getErrorMessage());
        });
    }

    @Override
    public void close() {
        try {
            browserSession.close();
        } catch (Exception ex) {
            log.warn("failed to close browser session, error={}", ex.getMessage(), ex);
        }
    }

    private static String validateUrl(String url) {
        if (!StringUtils.hasText(url)) {
            return "url is blank";
        }
        String lowerCaseUrl = url.trim().toLowerCase(Locale.ROOT);
        if (!lowerCaseUrl.startsWith("http://") && !lowerCaseUrl.startsWith("https://")) {
            return "unsupported url protocol";
        }
        return null;
    }

    private static String describe(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        if (!StringUtils.hasText(message)) {
            return cause.getClass().getSimpleName();
        }
        int lineEnd = message.indexOf('\n');
        return lineEnd > 0 ? message.substring(0, lineEnd).trim() : message;
    }

}
