package fun.fengwk.seo.core.utils;

import fun.fengwk.seo.core.service.keyword.model.ClusterPage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ReportToolCallResultConverterTest {

    private final ReportToolCallResultConverter converter = new ReportToolCallResultConverter();

    @Test
    public void shouldPassTextThrough() {
        assertThat(converter.convert("# SEO analysis", String.class)).isEqualTo("# SEO analysis");
        assertThat(converter.convert(new StringBuilder("ok"), StringBuilder.class)).isEqualTo("ok");
        assertThat(converter.convert("{\"status_code\" : 200}", String.class)).isEqualTo("{\"status_code\" : 200}");
    }

    @Test
    public void shouldConvertNullToEmpty() {
        assertThat(converter.convert(null, String.class)).isEmpty();
    }

    @Test
    public void shouldRejectNonTextResults() {
        assertThatThrownBy(() -> converter.convert(new ClusterPage("a", null, null, "coffee"), ClusterPage.class))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ClusterPage");
    }

}
