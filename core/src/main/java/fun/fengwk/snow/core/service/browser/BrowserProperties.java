package fun.fengwk.snow.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Browser runtime shared configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "snow.browser")
public class BrowserProperties {

    /**
     * Whether browsers run in headless mode.
     */
    private boolean headless = true;

    /**
     * Upper bound of workers in one browser session, 0 or less for no bound. A bound below the
     * batch size lowers fetch concurrency.
     */
    private int maxWorkersPerSession = 0;

    /**
     * Timeout when closing a worker and its browser.
     */
    private long closeTimeoutMs = 10000;

    /**
     * Optional fixed user agent for browser context.
     */
    private String userAgent = "";

    /**
     * Optional locale for browser context.
     */
    private String locale = "";

    /**
     * Optional timezone id for browser context.
     */
    private String timezoneId = "";

    /**
     * Extra headers for browser context.
     */
    private Map<String, String> extraHeaders = Map.of();

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of();

    /**
     * Ignore default args for browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

}
