package fun.fengwk.snow.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import fun.fengwk.snow.core.service.browser.BrowserProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens browser sessions configured from {@link BrowserProperties}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BrowserSessionFactory {

    private final BrowserProperties browserProperties;
    private final BrowserEngineFactory engineFactory;
    private final AtomicInteger workerIdGen = new AtomicInteger(1);

    @Autowired
    public BrowserSessionFactory(BrowserProperties browserProperties) {
        this(browserProperties, defaultEngineFactory(browserProperties));
    }

    BrowserSessionFactory(BrowserProperties browserProperties, BrowserEngineFactory engineFactory) {
        this.browserProperties = browserProperties;
        this.engineFactory = engineFactory;
    }

    /**
     * Open a session with {@code workerCount} workers, capped by the configured maximum if any.
     */
    public BrowserSession open(int workerCount) {
        int size = resolveWorkerCount(workerCount);
        List<BrowserWorker> workers = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            workers.add(new BrowserWorker(workerIdGen.getAndIncrement(), engineFactory, browserProperties.getCloseTimeoutMs()));
        }
        log.debug("browser session opened, workers={}", size);
        return new BrowserSession(workers);
    }

    int resolveWorkerCount(int workerCount) {
        int requested = Math.max(1, workerCount);
        int maxWorkers = browserProperties.getMaxWorkersPerSession();
        if (maxWorkers > 0 && requested > maxWorkers) {
            log.warn("browser session capped, requestedWorkers={}, maxWorkersPerSession={}", requested, maxWorkers);
            return maxWorkers;
        }
        return requested;
    }

    static BrowserEngineFactory defaultEngineFactory(BrowserProperties browserProperties) {
        return () -> {
            Playwright playwright = Playwright.create();
            try {
                Browser browser = playwright.chromium().launch(buildLaunchOptions(browserProperties));
                return new BrowserEngine(playwright, browser, buildContextOptions(browserProperties));
            } catch (RuntimeException ex) {
                playwright.close();
                throw ex;
            }
        };
    }

    static BrowserType.LaunchOptions buildLaunchOptions(BrowserProperties browserProperties) {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
            .setHeadless(browserProperties.isHeadless());
        if (browserProperties.getIgnoreDefaultArgs() != null && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }
        if (StringUtils.hasText(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }
        return options;
    }

    static Browser.NewContextOptions buildContextOptions(BrowserProperties browserProperties) {
        Browser.NewContextOptions options = new Browser.NewContextOptions();
        if (StringUtils.hasText(browserProperties.getUserAgent())) {
            options.setUserAgent(browserProperties.getUserAgent());
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.hasText(browserProperties.getTimezoneId())) {
            options.setTimezoneId(browserProperties.getTimezoneId());
        }
        if (browserProperties.getExtraHeaders() != null && !browserProperties.getExtraHeaders().isEmpty()) {
            options.setExtraHTTPHeaders(browserProperties.getExtraHeaders());
        }
        return options;
    }

}
