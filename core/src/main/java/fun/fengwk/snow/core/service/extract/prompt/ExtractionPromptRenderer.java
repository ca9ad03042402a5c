package fun.fengwk.snow.core.service.extract.prompt;

import freemarker.template.Template;
import fun.fengwk.snow.core.service.extract.ExtractProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.util.Map;

/**
 * Renders the extraction user prompt from its FreeMarker template.
 *
 * @author fengwk
 */
@Component
public class ExtractionPromptRenderer {

    private final freemarker.template.Configuration promptTemplateConfiguration;
    private final ExtractProperties extractProperties;

    public ExtractionPromptRenderer(
        @Qualifier("promptTemplateConfiguration") freemarker.template.Configuration promptTemplateConfiguration,
        ExtractProperties extractProperties
    ) {
        this.promptTemplateConfiguration = promptTemplateConfiguration;
        this.extractProperties = extractProperties;
    }

    /**
     * @param content report text of one page
     * @throws IllegalStateException when the template is missing or fails to render
     */
    public String render(String content) {
        StringWriter result = new StringWriter(4096);
        try {
            Template template = promptTemplateConfiguration.getTemplate(extractProperties.getPromptTemplate());
            template.process(Map.of("content", content == null ? "" : content), result);
            return result.toString();
        } catch (Exception ex) {
            throw new IllegalStateException("render prompt template failed: " + ex.getMessage(), ex);
        }
    }

}
