package fun.fengwk.seo.core.service.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Renders reports as nested maps or JSON with snake_case property names.
 *
 * @author fengwk
 */
@Component
public class SeoReportWriter {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper reportMapper;

    public SeoReportWriter(ObjectMapper objectMapper) {
        this.reportMapper = objectMapper.copy()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public Map<String, Object> toMap(Object report) {
        if (report == null) {
            return Map.of();
        }
        return reportMapper.convertValue(report, MAP_TYPE);
    }

    public String toJson(Object report) {
        try {
            return reportMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("report serialization failed: " + ex.getOriginalMessage(), ex);
        }
    }

}
