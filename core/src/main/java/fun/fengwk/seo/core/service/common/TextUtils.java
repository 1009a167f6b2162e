package fun.fengwk.seo.core.service.common;

import org.apache.commons.lang3.StringUtils;
import org.jsoup.parser.Parser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Plain-text helpers shared by the analyzers.
 *
 * @author fengwk
 */
public final class TextUtils {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile(
        "<(script|style|noscript)\\b[^>]*>.*?</\\1>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|(?<=[。！？])");
    private static final Pattern WORD_CHAR = Pattern.compile("[\\p{L}\\p{N}]");
    private static final Pattern TERM = Pattern.compile("[\\p{L}\\p{N}]+(?:['-][\\p{L}\\p{N}]+)*");

    private TextUtils() {
    }

    /**
     * Collapses runs of whitespace into one space and trims.
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.replace('\u00A0', ' ')).replaceAll(" ").trim();
    }

    /**
     * Lowercases and collapses whitespace, the canonical form for keyword matching.
     */
    public static String normalize(String text) {
        return collapseWhitespace(text).toLowerCase(Locale.ROOT);
    }

    /**
     * Regex-only markup removal used when no DOM is available.
     */
    public static String stripTags(String html) {
        if (StringUtils.isBlank(html)) {
            return "";
        }
        String withoutScripts = SCRIPT_OR_STYLE.matcher(html).replaceAll(" ");
        String withoutTags = TAG.matcher(withoutScripts).replaceAll(" ");
        return collapseWhitespace(Parser.unescapeEntities(withoutTags, false));
    }

    public static int countWords(String text) {
        String collapsed = collapseWhitespace(text);
        if (collapsed.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(collapsed).length;
    }

    public static List<String> splitWords(String text) {
        String collapsed = collapseWhitespace(text);
        if (collapsed.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(collapsed));
    }

    /**
     * Splits on terminal punctuation followed by whitespace, dropping fragments without a word.
     */
    public static List<String> splitSentences(String text) {
        String collapsed = collapseWhitespace(text);
        List<String> sentences = new ArrayList<>();
        if (collapsed.isEmpty()) {
            return sentences;
        }
        for (String fragment : SENTENCE_BOUNDARY.split(collapsed)) {
            String sentence = fragment.trim();
            if (containsWordCharacter(sentence)) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }

    public static boolean containsWordCharacter(String text) {
        return text != null && WORD_CHAR.matcher(text).find();
    }

    /**
     * Lowercase terms made of letters and digits, punctuation stripped.
     */
    public static List<String> extractTerms(String text) {
        List<String> terms = new ArrayList<>();
        if (StringUtils.isBlank(text)) {
            return terms;
        }
        var matcher = TERM.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            terms.add(matcher.group());
        }
        return terms;
    }

    /**
     * Non-overlapping occurrence offsets of needle in haystack.
     */
    public static List<Integer> findOccurrences(String haystack, String needle) {
        List<Integer> offsets = new ArrayList<>();
        if (StringUtils.isEmpty(haystack) || StringUtils.isEmpty(needle)) {
            return offsets;
        }
        int from = 0;
        int index;
        while ((index = haystack.indexOf(needle, from)) >= 0) {
            offsets.add(index);
            from = index + needle.length();
        }
        return offsets;
    }

    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0D;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    public static double percentage(long part, long total) {
        if (total <= 0) {
            return 0D;
        }
        return round(part * 100D / total, 2);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

}
