package fun.fengwk.snow.core.service.fetch.runtime;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import fun.fengwk.snow.core.service.browser.runtime.BrowserRuntimeContext;
import fun.fengwk.snow.core.service.fetch.FetchProperties;
import fun.fengwk.snow.core.service.fetch.model.FetchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class PageFetchTaskTest {

    private Page page;
    private Response response;
    private BrowserRuntimeContext context;

    @BeforeEach
    public void setUp() {
        page = mock(Page.class);
        response = mock(Response.class);
        context = BrowserRuntimeContext.builder().workerId(1).page(page).build();
        when(page.navigate(eq("https://example.com/report"), any(Page.NavigateOptions.class))).thenReturn(response);
    }

    @Test
    public void shouldReturnRenderedHtmlWithoutCache() {
        when(response.status()).thenReturn(200);
        when(page.content()).thenReturn("<html>report</html>");

        FetchResult result = new PageFetchTask("https://example.com/report", new FetchProperties()).execute(context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getHtml()).isEqualTo("<html>report</html>");
        verify(page).setExtraHTTPHeaders(PageFetchTask.NO_CACHE_HEADERS);
        verify(page).waitForLoadState(eq(LoadState.NETWORKIDLE), any(Page.WaitForLoadStateOptions.class));
    }

    @Test
    public void shouldFailOnHttpErrorStatus() {
        when(response.status()).thenReturn(404);

        FetchResult result = new PageFetchTask("https://example.com/report", new FetchProperties()).execute(context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("http status 404");
        verify(page, never()).content();
    }

    @Test
    public void shouldTolerateNetworkIdleTimeout() {
        when(response.status()).thenReturn(200);
        when(page.content()).thenReturn("<html>late</html>");
        doThrow(new TimeoutError("Timeout 10000ms exceeded"))
            .when(page).waitForLoadState(eq(LoadState.NETWORKIDLE), any(Page.WaitForLoadStateOptions.class));

        FetchResult result = new PageFetchTask("https://example.com/report", new FetchProperties()).execute(context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getHtml()).isEqualTo("<html>late</html>");
    }

    @Test
    public void shouldSkipOptionalStepsWhenDisabled() {
        when(response.status()).thenReturn(500);
        when(page.content()).thenReturn("<html>error page</html>");
        FetchProperties properties = new FetchProperties();
        properties.setBypassCache(false);
        properties.setWaitForNetworkIdle(false);
        properties.setFailOnHttpError(false);

        FetchResult result = new PageFetchTask("https://example.com/report", properties).execute(context);

        assertThat(result.isSuccess()).isTrue();
        verify(page, never()).setExtraHTTPHeaders(any());
        verify(page, never()).waitForLoadState(any(LoadState.class), any(Page.WaitForLoadStateOptions.class));
    }

}
