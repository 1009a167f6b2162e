package fun.fengwk.seo.core.service.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class TextUtilsTest {

    @Test
    public void shouldCollapseWhitespaceAndNonBreakingSpaces() {
        assertThat(TextUtils.collapseWhitespace("  a  b \n\t c ")).isEqualTo("a b c");
        assertThat(TextUtils.collapseWhitespace(null)).isEmpty();
    }

    @Test
    public void shouldStripTagsScriptsAndEntities() {
        String html = "<div><script>var x = 1;</script><p>Fish &amp; chips</p><style>p{}</style></div>";
        assertThat(TextUtils.stripTags(html)).isEqualTo("Fish & chips");
    }

    @Test
    public void shouldSplitSentencesOnTerminalPunctuation() {
        assertThat(TextUtils.splitSentences("First one. Second one! Third? ..."))
            .containsExactly("First one.", "Second one!", "Third?");
    }

    @Test
    public void shouldExtractLowercaseTerms() {
        assertThat(TextUtils.extractTerms("Don't stop, Wi-Fi 2024!"))
            .containsExactly("don't", "stop", "wi-fi", "2024");
    }

    @Test
    public void shouldFindNonOverlappingOccurrences() {
        assertThat(TextUtils.findOccurrences("aaaa", "aa")).containsExactly(0, 2);
        assertThat(TextUtils.findOccurrences("abc", "")).isEmpty();
    }

    @Test
    public void shouldComputePercentageSafely() {
        assertThat(TextUtils.percentage(2, 9)).isEqualTo(22.22);
        assertThat(TextUtils.percentage(5, 0)).isEqualTo(0D);
        assertThat(TextUtils.round(Double.NaN, 2)).isEqualTo(0D);
    }

}
