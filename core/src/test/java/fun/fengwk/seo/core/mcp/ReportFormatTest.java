package fun.fengwk.seo.core.mcp;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ReportFormatTest {

    @Test
    public void shouldParseFormatValues() {
        assertThat(ReportFormat.fromValue(null)).isEqualTo(ReportFormat.TEXT);
        assertThat(ReportFormat.fromValue(" ")).isEqualTo(ReportFormat.TEXT);
        assertThat(ReportFormat.fromValue("Json ")).isEqualTo(ReportFormat.JSON);
        assertThatThrownBy(() -> ReportFormat.fromValue("xml"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("unsupported format: xml");
    }

}
