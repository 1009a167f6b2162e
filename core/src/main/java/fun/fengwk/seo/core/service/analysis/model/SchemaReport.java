package fun.fengwk.seo.core.service.analysis.model;

import fun.fengwk.seo.core.service.schema.model.LocalBusinessCompleteness;
import fun.fengwk.seo.core.service.schema.model.SchemaEntity;
import fun.fengwk.seo.core.service.schema.model.SchemaValidationSummary;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class SchemaReport {

    private List<String> types;
    private List<SchemaEntity> entities;
    private SchemaValidationSummary validation;
    private List<LocalBusinessCompleteness> localBusinesses;

}
