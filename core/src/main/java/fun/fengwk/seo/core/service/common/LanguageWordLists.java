package fun.fengwk.seo.core.service.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-language word tables: stop words, transition words and words never counted as complex.
 *
 * <p>Lookups fall back to {@link #DEFAULT_LANGUAGE} when a language has no table.
 *
 * @author fengwk
 */
@Data
public class LanguageWordLists {

    public static final String DEFAULT_LANGUAGE = "en";
    public static final String DEFAULT_RESOURCE = "/seo/word-lists.json";

    private Map<String, List<String>> stopWords = new LinkedHashMap<>();
    private Map<String, List<String>> transitionWords = new LinkedHashMap<>();
    private Map<String, List<String>> nonComplexWords = new LinkedHashMap<>();

    public static LanguageWordLists load(ObjectMapper objectMapper, String resource) {
        try (InputStream in = LanguageWordLists.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("word list resource not found: " + resource);
            }
            return objectMapper.readValue(in, LanguageWordLists.class);
        } catch (IOException ex) {
            throw new UncheckedIOException("load word lists failed: " + resource, ex);
        }
    }

    public static LanguageWordLists defaults() {
        return load(new ObjectMapper(), DEFAULT_RESOURCE);
    }

    public List<String> stopWordsFor(String language) {
        return lookup(stopWords, language);
    }

    public List<String> transitionWordsFor(String language) {
        return lookup(transitionWords, language);
    }

    /**
     * Exception list is language specific, no fallback.
     */
    public List<String> nonComplexWordsFor(String language) {
        return nonComplexWords.getOrDefault(languageKey(language), List.of());
    }

    private List<String> lookup(Map<String, List<String>> table, String language) {
        List<String> words = table.get(languageKey(language));
        if (words != null) {
            return words;
        }
        return table.getOrDefault(DEFAULT_LANGUAGE, List.of());
    }

    private String languageKey(String language) {
        return StringUtils.isBlank(language) ? DEFAULT_LANGUAGE : language.trim().toLowerCase(Locale.ROOT);
    }

}
