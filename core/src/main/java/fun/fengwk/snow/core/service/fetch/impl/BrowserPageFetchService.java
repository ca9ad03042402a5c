package fun.fengwk.snow.core.service.fetch.impl;

import fun.fengwk.snow.core.service.browser.runtime.BrowserSessionFactory;
import fun.fengwk.snow.core.service.fetch.FetchProperties;
import fun.fengwk.snow.core.service.fetch.FetchSession;
import fun.fengwk.snow.core.service.fetch.PageFetchService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Page fetch service implementation on a headless browser.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class BrowserPageFetchService implements PageFetchService {

    private final BrowserSessionFactory browserSessionFactory;
    private final FetchProperties fetchProperties;

    @Override
    public FetchSession openSession(int concurrency) {
        return new BrowserFetchSession(browserSessionFactory.open(concurrency), fetchProperties);
    }

}
