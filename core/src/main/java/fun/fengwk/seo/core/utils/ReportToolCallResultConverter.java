package fun.fengwk.seo.core.utils;

import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Hands the rendered report text back to the MCP client unchanged. Tools render their own json format, so only
 * text results are accepted.
 *
 * @author fengwk
 */
public class ReportToolCallResultConverter implements ToolCallResultConverter {

    @Override
    public String convert(Object result, Type returnType) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence cs) {
            return cs.toString();
        }
        throw new IllegalStateException("unsupported result type: " + result.getClass());
    }

}
