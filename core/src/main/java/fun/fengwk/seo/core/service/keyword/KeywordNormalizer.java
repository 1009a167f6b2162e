package fun.fengwk.seo.core.service.keyword;

import fun.fengwk.seo.core.service.common.LanguageWordLists;
import fun.fengwk.seo.core.service.common.TextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical keyword forms: lowercase, whitespace collapsed, optional stop-word removal.
 *
 * @author fengwk
 */
@Component
public class KeywordNormalizer {

    private final Set<String> stopWords;

    public KeywordNormalizer(LanguageWordLists wordLists) {
        this.stopWords = new HashSet<>(wordLists.stopWordsFor(LanguageWordLists.DEFAULT_LANGUAGE));
    }

    public String normalize(String keyword) {
        return TextUtils.normalize(keyword);
    }

    /**
     * Normalized form without stop words, used for similarity.
     */
    public String normalizeForComparison(String keyword) {
        return TextUtils.splitWords(normalize(keyword)).stream()
            .filter(word -> !stopWords.contains(word))
            .collect(Collectors.joining(" "));
    }

    public boolean isStopWord(String word) {
        return stopWords.contains(word);
    }

    /**
     * Naive plural/singular variants of a keyword, the keyword itself first.
     */
    public List<String> variations(String keyword) {
        String normalized = normalize(keyword);
        List<String> variations = new ArrayList<>();
        if (normalized.isEmpty()) {
            return variations;
        }
        variations.add(normalized);
        if (normalized.endsWith("s")) {
            if (normalized.length() > 1) {
                variations.add(normalized.substring(0, normalized.length() - 1));
            }
        } else {
            variations.add(normalized + "s");
        }
        return variations;
    }

    /**
     * Normalized, de-duplicated secondary keywords in input order, primary and blanks removed.
     */
    public List<String> secondaryKeywords(String primaryKeyword, List<String> secondaryKeywords) {
        String primary = normalize(primaryKeyword);
        Set<String> result = new LinkedHashSet<>();
        if (secondaryKeywords != null) {
            for (String secondary : secondaryKeywords) {
                String normalized = normalize(secondary);
                if (!normalized.isEmpty() && !normalized.equals(primary)) {
                    result.add(normalized);
                }
            }
        }
        return new ArrayList<>(result);
    }

}
