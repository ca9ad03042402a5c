package fun.fengwk.snow.core.facade.completion.openai;

import lombok.Builder;
import lombok.Data;

/**
 * Raw response from the chat completions endpoint.
 *
 * @author fengwk
 */
@Data
@Builder
public class OpenAiClientResponse {

    private int statusCode;
    private String body;
    private Throwable error;

    public boolean hasError() {
        return error != null;
    }

}
