package fun.fengwk.snow.core.facade.completion.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Chat completions HTTP client.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiClient {

    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final OpenAiProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    /**
     * Send one chat completion.
     *
     * @param systemPrompt system message
     * @param userPrompt user message
     * @param responseFormat response_format type, e.g. json_object, blank to omit
     * @return raw response, transport failures are reported through {@link OpenAiClientResponse#getError()}
     */
    public OpenAiClientResponse chat(String systemPrompt, String userPrompt, String responseFormat) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(buildUri())
                .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + properties.getApiKey())
                .POST(BodyPublishers.ofString(buildBody(systemPrompt, userPrompt, responseFormat), StandardCharsets.UTF_8))
                .build();
        } catch (Exception ex) {
            return OpenAiClientResponse.builder().error(ex).build();
        }

        try {
            HttpResponse<String> response = httpClient.send(request, BodyHandlers.ofString(StandardCharsets.UTF_8));
            return OpenAiClientResponse.builder()
                .statusCode(response.statusCode())
                .body(response.body())
                .build();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return OpenAiClientResponse.builder().error(ex).build();
        } catch (Exception ex) {
            log.debug("chat completion request failed, uri={}, error={}", request.uri(), ex.getMessage());
            return OpenAiClientResponse.builder().error(ex).build();
        }
    }

    private String buildBody(String systemPrompt, String userPrompt, String responseFormat) throws Exception {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.getModel());
        ArrayNode messages = root.putArray("messages");
        if (StringUtils.hasText(systemPrompt)) {
            messages.addObject().put("role", "system").put("content", systemPrompt);
        }
        messages.addObject().put("role", "user").put("content", userPrompt == null ? "" : userPrompt);
        if (StringUtils.hasText(responseFormat)) {
            root.putObject("response_format").put("type", responseFormat);
        }
        if (properties.getTemperature() != null) {
            root.put("temperature", properties.getTemperature());
        }
        return objectMapper.writeValueAsString(root);
    }

    private URI buildUri() {
        String baseUrl = StringUtils.hasText(properties.getBaseUrl())
            ? properties.getBaseUrl().trim()
            : "";
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return URI.create(baseUrl + CHAT_COMPLETIONS_PATH);
    }

}
