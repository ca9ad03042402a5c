package fun.fengwk.snow.core.service.fetch;

import fun.fengwk.snow.core.service.fetch.model.FetchResult;

import java.util.concurrent.CompletableFuture;

/**
 * Fetcher bound to one rendering engine instance.
 *
 * @author fengwk
 */
public interface FetchSession extends AutoCloseable {

    /**
     * Fetch one url. The future never completes exceptionally, failures are returned as
     * {@link FetchResult#failed(String, String)}.
     */
    CompletableFuture<FetchResult> fetch(String url);

    /**
     * Release the rendering engine, never throws.
     */
    @Override
    void close();

}
