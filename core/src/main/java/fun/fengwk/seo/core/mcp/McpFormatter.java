package fun.fengwk.seo.core.mcp;

import freemarker.template.Template;
import fun.fengwk.seo.core.service.analysis.SeoReportWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.util.Map;

/**
 * Renders tool responses either through a FreeMarker template or as JSON.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class McpFormatter {

    private final freemarker.template.Configuration mcpTemplateConfiguration;
    private final SeoReportWriter seoReportWriter;

    public McpFormatter(@Qualifier("mcpTemplateConfiguration") freemarker.template.Configuration mcpTemplateConfiguration,
                        SeoReportWriter seoReportWriter) {
        this.mcpTemplateConfiguration = mcpTemplateConfiguration;
        this.seoReportWriter = seoReportWriter;
    }

    public String format(String templateName, Object model, ReportFormat format) {
        if (model == null) {
            return "empty response";
        }
        if (format == ReportFormat.JSON) {
            try {
                return seoReportWriter.toJson(model);
            } catch (IllegalStateException ex) {
                log.warn("json format failed, error={}", ex.getMessage());
                return "format error: " + ex.getMessage();
            }
        }
        return format(templateName, model);
    }

    /**
     * The template sees the response under {@code data}, with snake_case keys.
     */
    public String format(String templateName, Object model) {
        if (model == null) {
            return "empty response";
        }
        StringWriter result = new StringWriter(4096);
        try {
            Template template = mcpTemplateConfiguration.getTemplate(templateName);
            Object data = model instanceof Map ? model : seoReportWriter.toMap(model);
            template.process(Map.of("data", data), result);
            return result.toString();
        } catch (Exception e) {
            log.warn("template format failed, template={}, error={}", templateName, e.getMessage());
            return "format error: " + e.getMessage();
        }
    }

}
