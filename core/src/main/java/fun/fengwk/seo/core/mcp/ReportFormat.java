package fun.fengwk.seo.core.mcp;

import org.apache.commons.lang3.StringUtils;

/**
 * Output format of MCP tool results.
 *
 * @author fengwk
 */
public enum ReportFormat {

    TEXT("text"),
    JSON("json");

    private final String value;

    ReportFormat(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ReportFormat fromValue(String value) {
        if (StringUtils.isBlank(value)) {
            return TEXT;
        }
        for (ReportFormat format : values()) {
            if (format.value.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("unsupported format: " + value);
    }

}
