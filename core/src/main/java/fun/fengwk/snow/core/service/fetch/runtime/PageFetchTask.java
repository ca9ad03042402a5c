package fun.fengwk.snow.core.service.fetch.runtime;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.snow.core.service.browser.runtime.BrowserRuntimeContext;
import fun.fengwk.snow.core.service.browser.runtime.BrowserTask;
import fun.fengwk.snow.core.service.fetch.FetchProperties;
import fun.fengwk.snow.core.service.fetch.model.FetchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Renders one page and returns its html.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class PageFetchTask implements BrowserTask<FetchResult> {

    static final Map<String, String> NO_CACHE_HEADERS = Map.of(
        "Cache-Control", "no-cache",
        "Pragma", "no-cache"
    );

    private final String url;
    private final FetchProperties fetchProperties;

    @Override
    public FetchResult execute(BrowserRuntimeContext context) {
        Page page = context.getPage();
        log.debug("fetching page, workerId={}, url={}", context.getWorkerId(), url);
        if (fetchProperties.isBypassCache()) {
            page.setExtraHTTPHeaders(NO_CACHE_HEADERS);
        }

        Response response = page.navigate(url,
            new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout((double) fetchProperties.getNavigateTimeoutMs())
        );
        if (fetchProperties.isFailOnHttpError() && response != null && response.status() >= 400) {
            return FetchResult.failed(url, "http status " + response.status());
        }

        if (fetchProperties.isWaitForNetworkIdle()) {
            waitForNetworkIdleBestEffort(page);
        }
        return FetchResult.ok(url, page.content());
    }

    private void waitForNetworkIdleBestEffort(Page page) {
        try {
            // NETWORKIDLE may never happen for long-polling pages, treat it as best-effort.
            page.waitForLoadState(
                LoadState.NETWORKIDLE,
                new Page.WaitForLoadStateOptions().setTimeout((double) fetchProperties.getNetworkIdleTimeoutMs())
            );
        } catch (TimeoutError ex) {
            log.debug("network idle timeout, url={}", url);
        }
    }

}
