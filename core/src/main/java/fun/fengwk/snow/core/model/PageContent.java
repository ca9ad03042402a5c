package fun.fengwk.snow.core.model;

import lombok.Value;

/**
 * Rendered markup of one fetched page.
 *
 * @author fengwk
 */
@Value
public class PageContent {

    String url;
    String html;

}
