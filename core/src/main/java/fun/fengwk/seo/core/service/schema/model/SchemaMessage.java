package fun.fengwk.seo.core.service.schema.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class SchemaMessage {

    private int schemaIndex;
    private String schemaType;
    private String message;

}
