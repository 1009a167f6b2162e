package fun.fengwk.seo.core.service.schema.support;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates issues and warnings while validating one entity.
 *
 * @author fengwk
 */
@Getter
public class ValidationCollector {

    private final List<String> issues = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void issue(String message) {
        issues.add(message);
    }

    public void warning(String message) {
        warnings.add(message);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

}
