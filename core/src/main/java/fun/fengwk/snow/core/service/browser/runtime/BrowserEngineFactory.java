package fun.fengwk.snow.core.service.browser.runtime;

/**
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserEngineFactory {

    BrowserEngine create();

}
