package fun.fengwk.seo.core.service.keyword;

import fun.fengwk.seo.core.service.common.TextUtils;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Symmetric keyword similarity on a 0-100 scale.
 *
 * <p>Identical normalized keywords score 100, containment scores 90, anything else takes the better of the
 * Levenshtein ratio and the word overlap ratio.
 *
 * @author fengwk
 */
@Component
public class KeywordSimilarity {

    private final KeywordNormalizer keywordNormalizer;

    public KeywordSimilarity(KeywordNormalizer keywordNormalizer) {
        this.keywordNormalizer = keywordNormalizer;
    }

    public double similarity(String first, String second) {
        String a = comparable(first);
        String b = comparable(second);
        if (a.equals(b)) {
            return a.isEmpty() ? 0D : 100D;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0D;
        }
        if (a.contains(b) || b.contains(a)) {
            return 90D;
        }
        int maxLength = Math.max(a.length(), b.length());
        double levenshteinRatio = (1D - (double) levenshtein(a, b) / maxLength) * 100D;
        return TextUtils.round(Math.max(levenshteinRatio, wordOverlap(a, b)), 2);
    }

    private String comparable(String keyword) {
        String withoutStopWords = keywordNormalizer.normalizeForComparison(keyword);
        return withoutStopWords.isEmpty() ? keywordNormalizer.normalize(keyword) : withoutStopWords;
    }

    private double wordOverlap(String a, String b) {
        Set<String> wordsA = new HashSet<>(TextUtils.splitWords(a));
        Set<String> wordsB = new HashSet<>(TextUtils.splitWords(b));
        Set<String> union = new LinkedHashSet<>(wordsA);
        union.addAll(wordsB);
        if (union.isEmpty()) {
            return 0D;
        }
        wordsA.retainAll(wordsB);
        return wordsA.size() * 100D / union.size();
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

}
