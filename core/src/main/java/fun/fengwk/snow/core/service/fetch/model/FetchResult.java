package fun.fengwk.snow.core.service.fetch.model;

import lombok.Value;

/**
 * Result of fetching one url: rendered html on success, an error message otherwise.
 *
 * @author fengwk
 */
@Value
public class FetchResult {

    String url;
    boolean success;
    String html;
    String errorMessage;

    public static FetchResult ok(String url, String html) {
        return new FetchResult(url, true, html == null ? "" : html, null);
    }

    public static FetchResult failed(String url, String errorMessage) {
        return new FetchResult(url, false, null, errorMessage == null ? "fetch failed" : errorMessage);
    }

}
