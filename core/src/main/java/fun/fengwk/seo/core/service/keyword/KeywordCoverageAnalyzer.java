package fun.fengwk.seo.core.service.keyword;

import fun.fengwk.seo.core.service.common.TextUtils;
import fun.fengwk.seo.core.service.keyword.model.KeywordCoverage;
import fun.fengwk.seo.core.service.keyword.model.KeywordMapEntry;
import fun.fengwk.seo.core.service.keyword.model.TermFrequency;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Site-wide keyword coverage and gap discovery.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class KeywordCoverageAnalyzer {

    private static final int MAX_MOST_USED = 10;
    private static final int OVERUSE_COUNT = 3;
    private static final int MAX_GAPS = 10;
    private static final int MIN_GAP_LENGTH = 6;

    private final KeywordNormalizer keywordNormalizer;

    public KeywordCoverage analyze(List<KeywordMapEntry> entries) {
        List<String> assignments = new ArrayList<>();
        if (entries != null) {
            for (KeywordMapEntry entry : entries) {
                if (entry == null) {
                    continue;
                }
                String primary = keywordNormalizer.normalize(entry.getPrimaryKeyword());
                if (!primary.isEmpty()) {
                    assignments.add(primary);
                }
                assignments.addAll(keywordNormalizer.secondaryKeywords(primary, entry.getSecondaryKeywords()));
            }
        }

        Map<String, Integer> frequency = new LinkedHashMap<>();
        assignments.forEach(keyword -> frequency.merge(keyword, 1, Integer::sum));
        List<TermFrequency> ranked = new ArrayList<>();
        frequency.forEach((keyword, count) -> ranked.add(new TermFrequency(keyword, count)));
        ranked.sort(Comparator.comparingInt(TermFrequency::getCount).reversed());

        int total = assignments.size();
        int unique = frequency.size();
        return KeywordCoverage.builder()
            .totalKeywords(total)
            .uniqueKeywords(unique)
            .keywordDiversityScore(unique == 0 ? 0D : TextUtils.round((double) total / unique, 2))
            .mostUsedKeywords(ranked.stream().limit(MAX_MOST_USED).collect(Collectors.toList()))
            .overusedKeywords(ranked.stream().filter(t -> t.getCount() > OVERUSE_COUNT).collect(Collectors.toList()))
            .underusedKeywords(ranked.stream().filter(t -> t.getCount() == 1).collect(Collectors.toList()))
            .keywordGaps(identifyGaps(frequency.keySet()))
            .build();
    }

    /**
     * Shorter variants of multi-word keywords, one word dropped at a time, that nothing targets yet.
     */
    public List<String> identifyGaps(Set<String> usedKeywords) {
        Set<String> gaps = new LinkedHashSet<>();
        for (String keyword : usedKeywords) {
            List<String> words = TextUtils.splitWords(keyword);
            if (words.size() < 2) {
                continue;
            }
            for (int skip = 0; skip < words.size(); skip++) {
                List<String> remaining = new ArrayList<>(words);
                remaining.remove(skip);
                String variation = String.join(" ", remaining);
                if (variation.length() >= MIN_GAP_LENGTH && !usedKeywords.contains(variation)) {
                    gaps.add(variation);
                    if (gaps.size() >= MAX_GAPS) {
                        return new ArrayList<>(gaps);
                    }
                }
            }
        }
        return new ArrayList<>(gaps);
    }

}
