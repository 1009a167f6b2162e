package fun.fengwk.seo.core.configuration;

import freemarker.template.TemplateExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

/**
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    @Bean(name = "mcpTemplateConfiguration")
    public freemarker.template.Configuration mcpTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_34);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), "/mcp/templates/");
        cfg.setDefaultEncoding("UTF-8");
        // scores and counts are rendered without locale grouping
        cfg.setNumberFormat("computer");
        cfg.setBooleanFormat("c");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        return cfg;
    }

}
