package fun.fengwk.snow.core.facade.completion.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.snow.core.facade.completion.CompletionFacade;
import fun.fengwk.snow.core.facade.completion.model.CompletionRequest;
import fun.fengwk.snow.core.facade.completion.model.CompletionResponse;
import fun.fengwk.snow.core.facade.completion.openai.OpenAiClient;
import fun.fengwk.snow.core.facade.completion.openai.OpenAiClientResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class CompletionFacadeImpl implements CompletionFacade {

    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private final OpenAiClient openAiClient;
    private final ObjectMapper objectMapper;

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        if (request == null || !StringUtils.hasText(request.getUserPrompt())) {
            return CompletionResponse.builder()
                .error("user prompt is blank")
                .build();
        }

        OpenAiClientResponse response = openAiClient.chat(
            request.getSystemPrompt(),
            request.getUserPrompt(),
            request.getResponseFormat()
        );
        CompletionResponse.CompletionResponseBuilder builder = CompletionResponse.builder()
            .statusCode(response.getStatusCode());
        if (response.hasError()) {
            return builder.error(describe(response.getError())).build();
        }
        if (response.getStatusCode() < 200 || response.getStatusCode() >= 300) {
            return builder.error("completion backend returned status " + response.getStatusCode()
                + ": " + abbreviate(response.getBody())).build();
        }
        if (!StringUtils.hasText(response.getBody())) {
            return builder.error("empty response body").build();
        }

        try {
            JsonNode root = objectMapper.readTree(response.getBody());
            JsonNode choices = root.get("choices");
            if (choices == null || !choices.isArray() || choices.isEmpty()) {
                return builder.error("response has no choices").build();
            }
            JsonNode content = choices.get(0).path("message").get("content");
            if (content == null || content.isNull()) {
                return builder.error("response has no message content").build();
            }
            return builder.content(content.asText()).build();
        } catch (Exception ex) {
            return builder.error(ex.getMessage()).build();
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return StringUtils.hasText(message)
            ? error.getClass().getSimpleName() + ": " + message
            : error.getClass().getSimpleName();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY_LENGTH ? body : body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }

}
