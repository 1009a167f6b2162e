package fun.fengwk.seo.core.service.readability.impl;

import fun.fengwk.seo.core.configuration.SeoAnalysisProperties;
import fun.fengwk.seo.core.service.common.LanguageWordLists;
import fun.fengwk.seo.core.service.common.TextUtils;
import fun.fengwk.seo.core.service.readability.ReadabilityScorer;
import fun.fengwk.seo.core.service.readability.SyllableCounter;
import fun.fengwk.seo.core.service.readability.model.ParagraphLengthAnalysis;
import fun.fengwk.seo.core.service.readability.model.PassiveVoiceAnalysis;
import fun.fengwk.seo.core.service.readability.model.ReadabilityReport;
import fun.fengwk.seo.core.service.readability.model.SentenceLengthAnalysis;
import fun.fengwk.seo.core.service.readability.model.TransitionWordAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Readability scorer covering Flesch reading ease, SMOG, Coleman-Liau and style checks.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class DefaultReadabilityScorer implements ReadabilityScorer {

    private static final Set<String> CJK_LANGUAGES = Set.of("zh", "ja", "ko", "zh-hans", "zh-hant");
    private static final Pattern CJK_IGNORED = Pattern.compile("[\\p{P}\\p{Zs}\\s]");
    private static final Pattern NON_WHITESPACE = Pattern.compile("\\S");
    private static final Pattern PASSIVE_VOICE = Pattern.compile(
        "\\b(is|are|was|were|be|been|being)\\s+(\\w+ed|\\w+en|\\w+t)\\b", Pattern.CASE_INSENSITIVE);

    private static final String NOT_APPLICABLE = "Analysis not applicable for this language";
    private static final String NOT_APPLICABLE_CJK = "N/A for CJK languages";

    private static final int MAX_LONG_SENTENCE_EXAMPLES = 5;
    private static final int MAX_LONG_PARAGRAPH_EXAMPLES = 3;
    private static final int MAX_PASSIVE_EXAMPLES = 3;
    private static final int SMOG_SAMPLE_SENTENCES = 30;
    private static final int LONG_PARAGRAPH_WORDS = 100;
    private static final int PARAGRAPH_EXAMPLE_LENGTH = 150;

    private final SeoAnalysisProperties properties;
    private final LanguageWordLists wordLists;
    private final SyllableCounter syllableCounter = new SyllableCounter();

    public DefaultReadabilityScorer(SeoAnalysisProperties properties, LanguageWordLists wordLists) {
        this.properties = properties;
        this.wordLists = wordLists;
    }

    @Override
    public ReadabilityReport score(String text, List<String> paragraphs, String language) {
        String lang = resolveLanguage(language);
        boolean cjk = CJK_LANGUAGES.contains(lang);
        String content = TextUtils.collapseWhitespace(text);
        List<String> sentences = TextUtils.splitSentences(content);
        List<String> words = TextUtils.splitWords(content);
        int wordCount = cjk ? countCjkCharacters(content) : words.size();
        int sentenceCount = sentences.size();
        double averageWordsPerSentence = sentenceCount == 0 ? 0D : TextUtils.round((double) wordCount / sentenceCount, 2);

        ReadabilityReport.ReadabilityReportBuilder builder = ReadabilityReport.builder()
            .language(lang)
            .cjk(cjk)
            .wordCount(wordCount)
            .sentenceCount(sentenceCount)
            .averageWordsPerSentence(averageWordsPerSentence)
            .sentenceLengths(analyzeSentenceLengths(sentences))
            .paragraphLengths(analyzeParagraphLengths(paragraphs == null ? List.of() : paragraphs))
            // passive voice and transition detection only work on space delimited words
            .passiveVoice(analyzePassiveVoice(cjk ? List.of() : sentences))
            .transitionWords(analyzeTransitionWords(cjk ? List.of() : sentences, lang));

        if (cjk) {
            return builder
                .gradeLevel(NOT_APPLICABLE_CJK)
                .colemanLiauIndex(colemanLiau(content, wordCount, sentenceCount))
                .build();
        }

        Set<String> nonComplex = new HashSet<>(wordLists.nonComplexWordsFor(lang));
        int syllables = 0;
        int complexWords = 0;
        for (String word : words) {
            int wordSyllables = syllableCounter.count(word, lang);
            syllables += wordSyllables;
            if (wordSyllables >= 3 && !nonComplex.contains(stripPunctuation(word))) {
                complexWords++;
            }
        }

        double flesch = fleschReadingEase(wordCount, sentenceCount, syllables);
        return builder
            .syllableCount(syllables)
            .complexWordCount(complexWords)
            .averageSyllablesPerWord(wordCount == 0 ? 0D : TextUtils.round((double) syllables / wordCount, 2))
            .fleschReadingEase(flesch)
            .gradeLevel(syllables > 0 ? gradeLevel(flesch) : NOT_APPLICABLE)
            .smogIndex(smog(complexWords, sentenceCount))
            .colemanLiauIndex(colemanLiau(content, wordCount, sentenceCount))
            .build();
    }

    @Override
    public double fleschReadingEase(int words, int sentences, int syllables) {
        if (words < 0 || sentences < 0 || syllables < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        if (words == 0 || sentences == 0) {
            return 0D;
        }
        double score = 206.835D - 1.015D * ((double) words / sentences) - 84.6D * ((double) syllables / words);
        return TextUtils.round(Math.max(0D, Math.min(100D, score)), 2);
    }

    String gradeLevel(double flesch) {
        if (flesch >= 90) {
            return "5th grade (Very easy to read)";
        }
        if (flesch >= 80) {
            return "6th grade (Easy to read)";
        }
        if (flesch >= 70) {
            return "7th grade (Fairly easy to read)";
        }
        if (flesch >= 60) {
            return "8th-9th grade (Plain English)";
        }
        if (flesch >= 50) {
            return "10th-12th grade (Fairly difficult)";
        }
        if (flesch >= 30) {
            return "College (Difficult)";
        }
        return "College graduate (Very difficult)";
    }

    /**
     * SMOG expects a 30 sentence sample. Below that the complex word count is first extrapolated to 30 sentences,
     * then the usual {@code 1.043 * sqrt(complex * 30 / sentences) + 3.1291} is applied.
     */
    double smog(int complexWords, int sentences) {
        if (complexWords == 0 && sentences == 0) {
            return 0D;
        }
        double complex = complexWords;
        int sampleSentences = sentences;
        if (sampleSentences < SMOG_SAMPLE_SENTENCES) {
            sampleSentences = Math.max(1, sampleSentences);
            complex = complex * SMOG_SAMPLE_SENTENCES / sampleSentences;
        }
        double score = 1.043D * Math.sqrt(complex * SMOG_SAMPLE_SENTENCES / sampleSentences) + 3.1291D;
        return TextUtils.round(score, 2);
    }

    double colemanLiau(String content, int words, int sentences) {
        if (words == 0 || sentences == 0) {
            return 0D;
        }
        long characters = NON_WHITESPACE.matcher(content).results().count();
        double letters = characters * 100D / words;
        double sentencesPerHundred = sentences * 100D / words;
        return TextUtils.round(0.0588D * letters - 0.296D * sentencesPerHundred - 15.8D, 2);
    }

    private SentenceLengthAnalysis analyzeSentenceLengths(List<String> sentences) {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (String bucket : List.of("very_short", "short", "medium", "long", "very_long", "extremely_long")) {
            distribution.put(bucket, 0);
        }
        List<String> longSentences = new ArrayList<>();
        int totalWords = 0;
        for (String sentence : sentences) {
            int length = TextUtils.countWords(sentence);
            totalWords += length;
            String bucket = sentenceBucket(length);
            distribution.merge(bucket, 1, Integer::sum);
            if ("very_long".equals(bucket) || "extremely_long".equals(bucket)) {
                longSentences.add(sentence);
            }
        }

        Map<String, Double> percentages = new LinkedHashMap<>();
        distribution.forEach((bucket, count) -> percentages.put(bucket, TextUtils.percentage(count, sentences.size())));

        List<String> examples = longSentences.stream()
            .sorted(Comparator.comparingInt(TextUtils::countWords).reversed())
            .limit(MAX_LONG_SENTENCE_EXAMPLES)
            .toList();

        return SentenceLengthAnalysis.builder()
            .totalSentences(sentences.size())
            .averageLength(sentences.isEmpty() ? 0D : TextUtils.round((double) totalWords / sentences.size(), 2))
            .distribution(distribution)
            .percentages(percentages)
            .longSentenceCount(longSentences.size())
            .longSentences(examples)
            .build();
    }

    private String sentenceBucket(int words) {
        if (words <= 5) {
            return "very_short";
        }
        if (words <= 10) {
            return "short";
        }
        if (words <= 15) {
            return "medium";
        }
        if (words <= 20) {
            return "long";
        }
        if (words <= 25) {
            return "very_long";
        }
        return "extremely_long";
    }

    private ParagraphLengthAnalysis analyzeParagraphLengths(List<String> paragraphs) {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (String bucket : List.of("0-20", "20-40", "40-60", "60-100", "100+")) {
            distribution.put(bucket, 0);
        }
        List<String> examples = new ArrayList<>();
        int longCount = 0;
        int totalWords = 0;
        for (String paragraph : paragraphs) {
            int words = TextUtils.countWords(paragraph);
            totalWords += words;
            distribution.merge(paragraphBucket(words), 1, Integer::sum);
            if (words > LONG_PARAGRAPH_WORDS) {
                longCount++;
                if (examples.size() < MAX_LONG_PARAGRAPH_EXAMPLES) {
                    examples.add(TextUtils.truncate(paragraph, PARAGRAPH_EXAMPLE_LENGTH));
                }
            }
        }
        return ParagraphLengthAnalysis.builder()
            .totalParagraphs(paragraphs.size())
            .averageLength(paragraphs.isEmpty() ? 0D : TextUtils.round((double) totalWords / paragraphs.size(), 2))
            .longParagraphCount(longCount)
            .longParagraphExamples(examples)
            .distribution(distribution)
            .build();
    }

    private String paragraphBucket(int words) {
        if (words <= 20) {
            return "0-20";
        }
        if (words <= 40) {
            return "20-40";
        }
        if (words <= 60) {
            return "40-60";
        }
        if (words <= 100) {
            return "60-100";
        }
        return "100+";
    }

    private PassiveVoiceAnalysis analyzePassiveVoice(List<String> sentences) {
        int passive = 0;
        List<String> examples = new ArrayList<>();
        for (String sentence : sentences) {
            if (PASSIVE_VOICE.matcher(sentence).find()) {
                passive++;
                if (examples.size() < MAX_PASSIVE_EXAMPLES) {
                    examples.add(sentence);
                }
            }
        }
        double percentage = TextUtils.percentage(passive, sentences.size());
        return PassiveVoiceAnalysis.builder()
            .passiveSentenceCount(passive)
            .percentage(percentage)
            .exceedsThreshold(percentage > properties.getPassiveVoiceThreshold())
            .examples(examples)
            .build();
    }

    private TransitionWordAnalysis analyzeTransitionWords(List<String> sentences, String language) {
        List<Pattern> patterns = new ArrayList<>();
        List<String> transitions = wordLists.transitionWordsFor(language);
        for (String transition : transitions) {
            patterns.add(Pattern.compile("\\b" + Pattern.quote(transition) + "\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        int matched = 0;
        Set<String> used = new LinkedHashSet<>();
        for (String sentence : sentences) {
            boolean found = false;
            for (int i = 0; i < patterns.size(); i++) {
                if (patterns.get(i).matcher(sentence).find()) {
                    used.add(transitions.get(i));
                    found = true;
                }
            }
            if (found) {
                matched++;
            }
        }
        double percentage = TextUtils.percentage(matched, sentences.size());
        return TransitionWordAnalysis.builder()
            .sentencesWithTransitions(matched)
            .percentage(percentage)
            .meetsThreshold(!sentences.isEmpty() && percentage >= properties.getTransitionWordsThreshold())
            .wordsUsed(new ArrayList<>(used))
            .build();
    }

    private int countCjkCharacters(String content) {
        return CJK_IGNORED.matcher(content).replaceAll("").length();
    }

    private String stripPunctuation(String word) {
        return word.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}]", "");
    }

    private String resolveLanguage(String language) {
        String lang = StringUtils.isBlank(language) ? properties.getDefaultLanguage() : language;
        String normalized = lang.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (CJK_LANGUAGES.contains(normalized)) {
            return normalized;
        }
        int dash = normalized.indexOf('-');
        return dash > 0 ? normalized.substring(0, dash) : normalized;
    }

}
