package fun.fengwk.seo.core.service.keyword.impl;

import fun.fengwk.seo.core.configuration.SeoAnalysisProperties;
import fun.fengwk.seo.core.service.common.TextUtils;
import fun.fengwk.seo.core.service.content.model.ContentBlock;
import fun.fengwk.seo.core.service.content.model.ExtractedContent;
import fun.fengwk.seo.core.service.document.PageDocument;
import fun.fengwk.seo.core.service.keyword.KeywordAnalyzer;
import fun.fengwk.seo.core.service.keyword.KeywordNormalizer;
import fun.fengwk.seo.core.service.keyword.model.BalanceStatus;
import fun.fengwk.seo.core.service.keyword.model.CompetitiveAssessment;
import fun.fengwk.seo.core.service.keyword.model.CountAssessment;
import fun.fengwk.seo.core.service.keyword.model.DensityAssessment;
import fun.fengwk.seo.core.service.keyword.model.DensityStatus;
import fun.fengwk.seo.core.service.keyword.model.HeadingLevelStats;
import fun.fengwk.seo.core.service.keyword.model.HeadingPresence;
import fun.fengwk.seo.core.service.keyword.model.KeywordAnalysis;
import fun.fengwk.seo.core.service.keyword.model.KeywordBalance;
import fun.fengwk.seo.core.service.keyword.model.KeywordReadability;
import fun.fengwk.seo.core.service.keyword.model.NaturalUsageAssessment;
import fun.fengwk.seo.core.service.keyword.model.ParagraphPresence;
import fun.fengwk.seo.core.service.keyword.model.ProximityAnalysis;
import fun.fengwk.seo.core.service.keyword.model.TermFrequency;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword analyzer working on the normalized plain text of extracted content.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class DefaultKeywordAnalyzer implements KeywordAnalyzer {

    private static final int MAX_CONTEXTS = 5;
    private static final int MAX_LSI_KEYWORDS = 10;
    private static final int COMPETING_TERM_CANDIDATES = 5;
    private static final int MIN_COMPETING_TERM_LENGTH = 4;
    private static final int MIN_TERM_LENGTH = 3;
    private static final double IDEAL_SENTENCE_LENGTH = 15D;
    private static final String CONTEXT_TERMS = "(improve|ranking|optimi[sz]e|visibility)";

    private final SeoAnalysisProperties properties;
    private final KeywordNormalizer keywordNormalizer;

    public DefaultKeywordAnalyzer(SeoAnalysisProperties properties, KeywordNormalizer keywordNormalizer) {
        this.properties = properties;
        this.keywordNormalizer = keywordNormalizer;
    }

    @Override
    public KeywordAnalysis analyze(String keyword, PageDocument document, ExtractedContent content) {
        String normalizedKeyword = keywordNormalizer.normalize(keyword);
        if (normalizedKeyword.isEmpty()) {
            throw new IllegalArgumentException("keyword must not be blank");
        }
        ExtractedContent source = content == null ? ExtractedContent.empty() : content;
        String text = source.getPlainText();
        String haystack = TextUtils.normalize(text);
        int wordCount = TextUtils.countWords(haystack);
        List<Integer> offsets = TextUtils.findOccurrences(haystack, normalizedKeyword);
        int count = offsets.size();
        int length = haystack.length();
        double density = density(count, wordCount);

        Double positionPercent = count == 0 ? null : TextUtils.round(offsets.get(0) * 100D / length, 2);
        double spread = count > 1
            ? TextUtils.round((double) (offsets.get(count - 1) - offsets.get(0)) / length, 2)
            : 0D;
        double distributionScore = distributionScore(offsets, length);

        List<String> keywordSentences = TextUtils.splitSentences(text).stream()
            .filter(sentence -> TextUtils.normalize(sentence).contains(normalizedKeyword))
            .collect(Collectors.toList());
        List<TermFrequency> rankedTerms = rankTerms(haystack, normalizedKeyword);

        boolean sufficient = count > 0
            && density >= properties.getDensityMin()
            && density <= properties.getDensityMax()
            && positionPercent < properties.getMaxFirstPositionPercent()
            && spread > properties.getMinSpread();

        log.debug("keyword analyzed, keyword={}, count={}, words={}, density={}",
            normalizedKeyword, count, wordCount, density);

        return KeywordAnalysis.builder()
            .keyword(normalizedKeyword)
            .variations(keywordNormalizer.variations(normalizedKeyword))
            .count(count)
            .wordCount(wordCount)
            .density(density)
            .densityStatus(densityStatus(density))
            .densityScore(densityScore(density))
            .positionPercent(positionPercent)
            .spread(spread)
            .contextualScore(contextualScore(haystack, normalizedKeyword))
            .headings(analyzeHeadings(source.getHeadings(), normalizedKeyword))
            .paragraphs(analyzeParagraphs(source.getParagraphs(), normalizedKeyword))
            .inFirstParagraph(containsKeyword(normalizedKeyword, source.getFirstParagraph()))
            .inMetaTitle(document != null && containsKeyword(normalizedKeyword, document.getTitle()))
            .inMetaDescription(document != null && containsKeyword(normalizedKeyword, document.getMetaDescription()))
            .naturalUsage(assessNaturalUsage(keywordSentences, normalizedKeyword))
            .proximity(new ProximityAnalysis(count, averageDistance(offsets), distributionScore))
            .competitive(assessCompetitiveness(count, wordCount, density))
            .keywordReadability(assessKeywordReadability(keywordSentences))
            .lsiKeywords(rankedTerms.stream().limit(MAX_LSI_KEYWORDS).collect(Collectors.toList()))
            .competingTerms(rankedTerms.stream()
                .limit(COMPETING_TERM_CANDIDATES)
                .filter(term -> term.getCount() > count && term.getTerm().length() >= MIN_COMPETING_TERM_LENGTH)
                .collect(Collectors.toList()))
            .sufficientUsage(sufficient)
            .fallbackUsed(source.isFallbackUsed())
            .build();
    }

    @Override
    public KeywordBalance balance(KeywordAnalysis primary, List<KeywordAnalysis> secondaries) {
        if (primary == null || secondaries == null || secondaries.isEmpty()) {
            return new KeywordBalance(null, BalanceStatus.INCOMPLETE, 0.5D);
        }
        double average = secondaries.stream().mapToDouble(KeywordAnalysis::getDensity).average().orElse(0D);
        if (average <= 0D) {
            return new KeywordBalance(null, BalanceStatus.INCOMPLETE, 0.5D);
        }
        double ratio = TextUtils.round(primary.getDensity() / average, 2);
        if (ratio < 1D) {
            return new KeywordBalance(ratio, BalanceStatus.SECONDARY_DOMINANT, 0.6D);
        }
        if (ratio <= 3D) {
            return new KeywordBalance(ratio, BalanceStatus.WELL_BALANCED, 1.0D);
        }
        if (ratio <= 5D) {
            return new KeywordBalance(ratio, BalanceStatus.PRIMARY_HEAVY, 0.7D);
        }
        return new KeywordBalance(ratio, BalanceStatus.PRIMARY_DOMINANT, 0.4D);
    }

    @Override
    public int countOccurrences(String keyword, String text) {
        return TextUtils.findOccurrences(TextUtils.normalize(text), keywordNormalizer.normalize(keyword)).size();
    }

    @Override
    public double density(int count, int wordCount) {
        if (count < 0 || wordCount < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        if (count == 0 || wordCount == 0) {
            return 0D;
        }
        return TextUtils.round(count * 100D / wordCount, 2);
    }

    @Override
    public DensityStatus densityStatus(double density) {
        if (density < properties.getDensityMin()) {
            return density < properties.getSevereUnderuseDensity() ? DensityStatus.SEVERELY_UNDERUSED : DensityStatus.UNDERUSED;
        }
        if (density > properties.getDensityMax()) {
            return density > properties.getSevereOveruseDensity() ? DensityStatus.SEVERELY_OVERUSED : DensityStatus.OVERUSED;
        }
        return DensityStatus.OPTIMAL;
    }

    @Override
    public double densityScore(double density) {
        double min = properties.getDensityMin();
        double max = properties.getDensityMax();
        if (density >= min && density <= max) {
            return 1D;
        }
        if (density <= 0D) {
            return 0D;
        }
        double score;
        if (density < min) {
            score = density / min;
        } else {
            double excess = (density - max) / max;
            score = 1D - Math.min(1D, excess * 1.5D);
        }
        return TextUtils.round(Math.max(0D, Math.min(1D, score)), 2);
    }

    @Override
    public double distributionScore(List<Integer> offsets, int textLength) {
        if (offsets == null || offsets.isEmpty() || textLength <= 0) {
            return 0D;
        }
        int n = offsets.size();
        double idealGap = (double) textLength / (n + 1);
        double totalDeviation = 0D;
        for (int i = 0; i < n; i++) {
            totalDeviation += Math.abs(offsets.get(i) - idealGap * (i + 1));
        }
        double averageDeviation = totalDeviation / n;
        double maxDeviation = textLength / 2D;
        double score = 10D - averageDeviation / maxDeviation * 10D;
        return Math.max(0D, Math.min(10D, TextUtils.round(score, 1)));
    }

    @Override
    public boolean containsKeyword(String keyword, String text) {
        String normalizedKeyword = keywordNormalizer.normalize(keyword);
        if (normalizedKeyword.isEmpty() || StringUtils.isBlank(text)) {
            return false;
        }
        return TextUtils.normalize(text).contains(normalizedKeyword);
    }

    private HeadingPresence analyzeHeadings(List<ContentBlock> headings, String keyword) {
        Map<String, List<String>> textsByLevel = new LinkedHashMap<>();
        Map<String, Integer> matchesByLevel = new LinkedHashMap<>();
        for (int level = 1; level <= 6; level++) {
            textsByLevel.put("h" + level, new ArrayList<>());
            matchesByLevel.put("h" + level, 0);
        }
        int withKeyword = 0;
        for (ContentBlock heading : headings) {
            String level = "h" + heading.getLevel();
            textsByLevel.get(level).add(heading.getText());
            if (containsKeyword(keyword, heading.getText())) {
                matchesByLevel.merge(level, 1, Integer::sum);
                withKeyword++;
            }
        }
        Map<String, HeadingLevelStats> levels = new LinkedHashMap<>();
        textsByLevel.forEach((level, texts) ->
            levels.put(level, new HeadingLevelStats(texts.size(), matchesByLevel.get(level), texts)));
        return HeadingPresence.builder()
            .totalHeadings(headings.size())
            .headingsWithKeyword(withKeyword)
            .levels(levels)
            .build();
    }

    private ParagraphPresence analyzeParagraphs(List<String> paragraphs, String keyword) {
        int withKeyword = (int) paragraphs.stream().filter(p -> containsKeyword(keyword, p)).count();
        return new ParagraphPresence(paragraphs.size(), withKeyword, TextUtils.percentage(withKeyword, paragraphs.size()));
    }

    private int contextualScore(String haystack, String keyword) {
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b.{0,50}" + CONTEXT_TERMS);
        Matcher matcher = pattern.matcher(haystack);
        int score = 0;
        while (matcher.find()) {
            score++;
        }
        return score;
    }

    /**
     * A context counts as stuffed when the keyword repeats within a few characters, opens the sentence,
     * or is comma-joined with itself.
     */
    private NaturalUsageAssessment assessNaturalUsage(List<String> keywordSentences, String keyword) {
        String quoted = Pattern.quote(keyword);
        List<Pattern> stuffingPatterns = List.of(
            Pattern.compile(quoted + ".{0,10}" + quoted),
            Pattern.compile("^" + quoted),
            Pattern.compile(quoted + "\\s*,\\s*" + quoted)
        );
        List<String> contexts = keywordSentences.stream().limit(MAX_CONTEXTS).collect(Collectors.toList());
        int stuffed = 0;
        for (String context : contexts) {
            String normalized = TextUtils.normalize(context);
            if (stuffingPatterns.stream().anyMatch(pattern -> pattern.matcher(normalized).find())) {
                stuffed++;
            }
        }
        double forced = TextUtils.percentage(stuffed, contexts.size());
        return NaturalUsageAssessment.builder()
            .contexts(contexts)
            .stuffedContexts(stuffed)
            .forcedUsagePercentage(forced)
            .natural(forced < properties.getForcedUsageThreshold())
            .build();
    }

    private double averageDistance(List<Integer> offsets) {
        if (offsets.size() < 2) {
            return 0D;
        }
        double total = 0D;
        for (int i = 1; i < offsets.size(); i++) {
            total += offsets.get(i) - offsets.get(i - 1);
        }
        return TextUtils.round(total / (offsets.size() - 1), 2);
    }

    private CompetitiveAssessment assessCompetitiveness(int count, int wordCount, double density) {
        DensityAssessment densityAssessment = DensityAssessment.OPTIMAL;
        if (density < properties.getIdealDensityMin()) {
            densityAssessment = DensityAssessment.UNDERDENSITY;
        } else if (density > properties.getIdealDensityMax()) {
            densityAssessment = DensityAssessment.OVERDENSITY;
        }
        int recommended = Math.max(1, (int) Math.ceil(wordCount / 100D));
        double ratio = TextUtils.round((double) count / recommended, 2);
        CountAssessment countAssessment = CountAssessment.OPTIMAL;
        if (ratio < 0.7D) {
            countAssessment = CountAssessment.INSUFFICIENT;
        } else if (ratio > 1.5D) {
            countAssessment = CountAssessment.EXCESSIVE;
        }
        return CompetitiveAssessment.builder()
            .densityAssessment(densityAssessment)
            .recommendedCount(recommended)
            .countRatio(ratio)
            .countAssessment(countAssessment)
            .build();
    }

    private KeywordReadability assessKeywordReadability(List<String> keywordSentences) {
        if (keywordSentences.isEmpty()) {
            return new KeywordReadability(0, 0D, 0D, "poor");
        }
        double average = keywordSentences.stream().mapToInt(TextUtils::countWords).average().orElse(0D);
        double score = TextUtils.round(10D - Math.min(10D, Math.abs(average - IDEAL_SENTENCE_LENGTH)), 2);
        String status = score < 4D ? "poor" : score < 7D ? "average" : "good";
        return new KeywordReadability(keywordSentences.size(), TextUtils.round(average, 2), score, status);
    }

    /**
     * Terms ranked by frequency, ties keep first-appearance order. Stop words and keyword parts are skipped.
     */
    private List<TermFrequency> rankTerms(String haystack, String keyword) {
        Set<String> keywordParts = new HashSet<>(TextUtils.splitWords(keyword));
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String term : TextUtils.extractTerms(haystack)) {
            if (term.length() < MIN_TERM_LENGTH || keywordNormalizer.isStopWord(term) || keywordParts.contains(term)) {
                continue;
            }
            counts.merge(term, 1, Integer::sum);
        }
        List<TermFrequency> ranked = new ArrayList<>();
        counts.forEach((term, count) -> ranked.add(new TermFrequency(term, count)));
        ranked.sort(Comparator.comparingInt(TermFrequency::getCount).reversed());
        return ranked;
    }

}
