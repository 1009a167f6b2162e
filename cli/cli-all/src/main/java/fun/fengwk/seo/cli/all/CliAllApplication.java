package fun.fengwk.seo.cli.all;

import fun.fengwk.seo.core.mcp.SeoMcp;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.seo")
public class CliAllApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliAllApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "spring.ai.mcp.server", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ToolCallbackProvider seoTools(SeoMcp seoMcp) {
        return MethodToolCallbackProvider.builder()
            .toolObjects(seoMcp)
            .build();
    }

}
