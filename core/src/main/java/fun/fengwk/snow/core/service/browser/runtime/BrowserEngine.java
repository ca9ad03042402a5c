package fun.fengwk.snow.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Playwright;

/**
 * One launched browser with the playwright instance that owns it.
 *
 * <p>Playwright objects are not thread safe, an engine must only be used by the thread that created it.
 *
 * @author fengwk
 */
public class BrowserEngine implements AutoCloseable {

    private final Playwright playwright;
    private final Browser browser;
    private final Browser.NewContextOptions contextOptions;

    public BrowserEngine(Playwright playwright, Browser browser, Browser.NewContextOptions contextOptions) {
        this.playwright = playwright;
        this.browser = browser;
        this.contextOptions = contextOptions;
    }

    /**
     * Open an isolated context: no cookies, storage or http cache shared with earlier pages.
     */
    public BrowserContext newContext() {
        return contextOptions == null ? browser.newContext() : browser.newContext(contextOptions);
    }

    @Override
    public void close() {
        try {
            browser.close();
        } finally {
            playwright.close();
        }
    }

}
