package fun.fengwk.snow.core.service.fetch;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Page fetch configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "snow.fetch")
public class FetchProperties {

    /**
     * Page navigate timeout in milliseconds.
     */
    private int navigateTimeoutMs = 30000;

    /**
     * Wait for network idle after DOM content loaded, best-effort.
     */
    private boolean waitForNetworkIdle = true;

    /**
     * Max wait for network idle in milliseconds.
     */
    private int networkIdleTimeoutMs = 10000;

    /**
     * Send no-cache request headers so every run observes live content.
     */
    private boolean bypassCache = true;

    /**
     * Treat a main document status of 400 or above as a fetch failure.
     */
    private boolean failOnHttpError = true;

}
