package fun.fengwk.snow.core.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

/**
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    public static final String PROMPT_TEMPLATE_PATH = "/prompts/";

    @Bean(name = "promptTemplateConfiguration")
    public freemarker.template.Configuration promptTemplateConfiguration() {
        return createPromptTemplateConfiguration();
    }

    public static freemarker.template.Configuration createPromptTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_34);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), PROMPT_TEMPLATE_PATH);
        cfg.setDefaultEncoding("UTF-8");
        return cfg;
    }

}
