package fun.fengwk.snow.core.service.pipeline;

import fun.fengwk.snow.core.service.fetch.FetchSession;
import fun.fengwk.snow.core.service.fetch.PageFetchService;
import fun.fengwk.snow.core.service.fetch.model.FetchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fetcher answering from the url itself: urls containing {@code broken} fail, others render a page
 * whose text is the last path segment.
 *
 * @author fengwk
 */
public class FakePageFetchService implements PageFetchService {

    final List<Integer> openedConcurrency = new ArrayList<>();
    int closedSessions;
    RuntimeException openFailure;

    @Override
    public FetchSession openSession(int concurrency) {
        if (openFailure != null) {
            throw openFailure;
        }
        openedConcurrency.add(concurrency);
        return new FetchSession() {

            @Override
            public CompletableFuture<FetchResult> fetch(String url) {
                if (url.contains("broken")) {
                    return CompletableFuture.completedFuture(FetchResult.failed(url, "navigation timeout"));
                }
                if (url.contains("explode")) {
                    return CompletableFuture.failedFuture(new IllegalStateException("worker crashed"));
                }
                return CompletableFuture.completedFuture(FetchResult.ok(url, "<p>" + lastSegment(url) + "</p>"));
            }

            @Override
            public void close() {
                closedSessions++;
            }
        };
    }

    static String lastSegment(String url) {
        return url.substring(url.lastIndexOf('/') + 1);
    }

}
