package fun.fengwk.snow.core.facade.completion.openai;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * OpenAI compatible completion backend configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "snow.completion.openai")
public class OpenAiProperties {

    /**
     * Api base url, the chat completions path is appended to it.
     */
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Api key sent as bearer token.
     */
    private String apiKey = "";

    /**
     * Model name.
     */
    private String model = "gpt-4o-mini";

    /**
     * Request timeout in milliseconds.
     */
    private int timeoutMs = 60000;

    /**
     * Sampling temperature, null keeps the backend default.
     */
    private Double temperature;

}
