package fun.fengwk.snow.core.service.extract;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Snow report extraction configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "snow.extract")
public class ExtractProperties {

    /**
     * CSS selectors of the report region, tried in order. The whole page is used when none matches.
     */
    private List<String> reportSelectors = List.of(
        "#__next > div.container-xl.content-container > div.styles_layout__Zkjid.layout-container > div > div.skireport_reportContent__Gmrl5",
        "div[class^=skireport_reportContent]"
    );

    /**
     * System prompt of every extraction request.
     */
    private String systemPrompt = "You extract ski resort snow report facts from web page text "
        + "and always answer with a single JSON object.";

    /**
     * FreeMarker template of the user prompt, resolved under the prompt template path.
     */
    private String promptTemplate = "snow_report_extraction.ftl";

}
