package fun.fengwk.snow.core.facade.completion.model;

import lombok.Builder;
import lombok.Data;

/**
 * Normalized completion response.
 *
 * @author fengwk
 */
@Data
@Builder
public class CompletionResponse {

    /**
     * HTTP status code from the backend, 0 when no response was received.
     */
    private int statusCode;

    /**
     * Message content of the first choice.
     */
    private String content;

    /**
     * Error message when the request fails or the envelope cannot be read.
     */
    private String error;

    /**
     * Whether the backend answered with a 2xx status, regardless of what the answer contains.
     */
    public boolean isDelivered() {
        return statusCode >= 200 && statusCode < 300;
    }

}
