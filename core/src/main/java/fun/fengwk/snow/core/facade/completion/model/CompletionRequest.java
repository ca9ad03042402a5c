package fun.fengwk.snow.core.facade.completion.model;

import lombok.Builder;
import lombok.Data;

/**
 * Completion request input.
 *
 * @author fengwk
 */
@Data
@Builder
public class CompletionRequest {

    public static final String FORMAT_JSON_OBJECT = "json_object";

    private String systemPrompt;

    private String userPrompt;

    /**
     * Requested structured output, {@link #FORMAT_JSON_OBJECT} or null for free text.
     */
    private String responseFormat;

}
