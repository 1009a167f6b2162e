package fun.fengwk.seo.core.service.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Stage result carrying an explicit outcome instead of a control-flow exception.
 *
 * @author fengwk
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AnalysisResult<T> {

    private final AnalysisOutcome outcome;
    private final T data;

    public static <T> AnalysisResult<T> ok(T data) {
        if (data == null) {
            throw new IllegalArgumentException("ok result requires data");
        }
        return new AnalysisResult<>(AnalysisOutcome.OK, data);
    }

    public static <T> AnalysisResult<T> empty() {
        return new AnalysisResult<>(AnalysisOutcome.EMPTY, null);
    }

    /**
     * @param degraded best-effort data recovered without a parsed tree, may be null
     */
    public static <T> AnalysisResult<T> parseFailure(T degraded) {
        return new AnalysisResult<>(AnalysisOutcome.PARSE_FAILURE, degraded);
    }

    public boolean isOk() {
        return outcome == AnalysisOutcome.OK;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(data);
    }

}
