package fun.fengwk.seo.core.service.analysis.impl;

import fun.fengwk.seo.core.configuration.SeoAnalysisProperties;
import fun.fengwk.seo.core.service.analysis.SeoAnalysisService;
import fun.fengwk.seo.core.service.analysis.model.AnalysisReport;
import fun.fengwk.seo.core.service.analysis.model.ContentSummary;
import fun.fengwk.seo.core.service.analysis.model.SchemaReport;
import fun.fengwk.seo.core.service.analysis.model.SeoAnalysisRequest;
import fun.fengwk.seo.core.service.analysis.model.SeoAnalysisResponse;
import fun.fengwk.seo.core.service.analysis.model.SiteKeywordReport;
import fun.fengwk.seo.core.service.analysis.model.SiteKeywordResponse;
import fun.fengwk.seo.core.service.common.AnalysisOutcome;
import fun.fengwk.seo.core.service.common.AnalysisResult;
import fun.fengwk.seo.core.service.common.TextUtils;
import fun.fengwk.seo.core.service.content.ContentExtractor;
import fun.fengwk.seo.core.service.content.model.ExtractedContent;
import fun.fengwk.seo.core.service.document.HtmlDocumentParser;
import fun.fengwk.seo.core.service.document.PageDocument;
import fun.fengwk.seo.core.service.intent.IntentClassifier;
import fun.fengwk.seo.core.service.intent.model.IntentProfile;
import fun.fengwk.seo.core.service.keyword.CannibalizationDetector;
import fun.fengwk.seo.core.service.keyword.KeywordAnalyzer;
import fun.fengwk.seo.core.service.keyword.KeywordCoverageAnalyzer;
import fun.fengwk.seo.core.service.keyword.KeywordNormalizer;
import fun.fengwk.seo.core.service.keyword.TopicClusterBuilder;
import fun.fengwk.seo.core.service.keyword.model.KeywordAnalysis;
import fun.fengwk.seo.core.service.keyword.model.KeywordMapEntry;
import fun.fengwk.seo.core.service.readability.ReadabilityScorer;
import fun.fengwk.seo.core.service.readability.model.ReadabilityReport;
import fun.fengwk.seo.core.service.schema.LocalBusinessSchemaInspector;
import fun.fengwk.seo.core.service.schema.SchemaExtractor;
import fun.fengwk.seo.core.service.schema.SchemaValidator;
import fun.fengwk.seo.core.service.schema.model.LocalBusinessCompleteness;
import fun.fengwk.seo.core.service.schema.model.SchemaEntity;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Orchestrates one page analysis.
 *
 * <p>The page is parsed and its content extracted first. Readability, keyword, schema and intent analysis then run
 * as independent tasks on the analysis executor against the same read-only document, and are joined before the
 * report is assembled. Either the whole report is returned or an error, never a partial report.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class SeoAnalysisServiceImpl implements SeoAnalysisService {

    private final SeoAnalysisProperties properties;
    private final HtmlDocumentParser htmlDocumentParser;
    private final ContentExtractor contentExtractor;
    private final KeywordNormalizer keywordNormalizer;
    private final KeywordAnalyzer keywordAnalyzer;
    private final ReadabilityScorer readabilityScorer;
    private final SchemaExtractor schemaExtractor;
    private final SchemaValidator schemaValidator;
    private final LocalBusinessSchemaInspector localBusinessSchemaInspector;
    private final IntentClassifier intentClassifier;
    private final CannibalizationDetector cannibalizationDetector;
    private final KeywordCoverageAnalyzer keywordCoverageAnalyzer;
    private final TopicClusterBuilder topicClusterBuilder;
    private final ExecutorService analysisExecutor;

    public SeoAnalysisServiceImpl(SeoAnalysisProperties properties,
                                  HtmlDocumentParser htmlDocumentParser,
                                  ContentExtractor contentExtractor,
                                  KeywordNormalizer keywordNormalizer,
                                  KeywordAnalyzer keywordAnalyzer,
                                  ReadabilityScorer readabilityScorer,
                                  SchemaExtractor schemaExtractor,
                                  SchemaValidator schemaValidator,
                                  LocalBusinessSchemaInspector localBusinessSchemaInspector,
                                  IntentClassifier intentClassifier,
                                  CannibalizationDetector cannibalizationDetector,
                                  KeywordCoverageAnalyzer keywordCoverageAnalyzer,
                                  TopicClusterBuilder topicClusterBuilder,
                                  @Qualifier("seoAnalysisExecutor") ExecutorService analysisExecutor) {
        this.properties = properties;
        this.htmlDocumentParser = htmlDocumentParser;
        this.contentExtractor = contentExtractor;
        this.keywordNormalizer = keywordNormalizer;
        this.keywordAnalyzer = keywordAnalyzer;
        this.readabilityScorer = readabilityScorer;
        this.schemaExtractor = schemaExtractor;
        this.schemaValidator = schemaValidator;
        this.localBusinessSchemaInspector = localBusinessSchemaInspector;
        this.intentClassifier = intentClassifier;
        this.cannibalizationDetector = cannibalizationDetector;
        this.keywordCoverageAnalyzer = keywordCoverageAnalyzer;
        this.topicClusterBuilder = topicClusterBuilder;
        this.analysisExecutor = analysisExecutor;
    }

    @Override
    public SeoAnalysisResponse analyze(SeoAnalysisRequest request) {
        long startAt = System.currentTimeMillis();
        try {
            validateRequest(request);
            AnalysisReport report = doAnalyze(request);
            return SeoAnalysisResponse.builder()
                .statusCode(200)
                .report(report)
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (IllegalArgumentException ex) {
            log.warn("analysis request invalid, baseUrl={}, error={}", request == null ? "" : request.getBaseUrl(), ex.getMessage());
            return SeoAnalysisResponse.builder()
                .statusCode(400)
                .error(ex.getMessage())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (Exception ex) {
            log.warn(
                "analysis failed, baseUrl={}, keyword={}, error={}",
                request == null ? "" : request.getBaseUrl(),
                request == null ? "" : request.getPrimaryKeyword(),
                ex.getMessage(),
                ex
            );
            return SeoAnalysisResponse.builder()
                .statusCode(500)
                .error(ex.getMessage())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        }
    }

    private void validateRequest(SeoAnalysisRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        if (request.getHtml() != null && request.getHtml().length() > properties.getMaxHtmlLength()) {
            throw new IllegalArgumentException("html exceeds " + properties.getMaxHtmlLength() + " characters");
        }
    }

    private AnalysisReport doAnalyze(SeoAnalysisRequest request) throws Exception {
        AnalysisResult<PageDocument> parsed = htmlDocumentParser.parse(request.getHtml(), request.getBaseUrl());
        PageDocument document = parsed.getData() == null
            ? htmlDocumentParser.unparsed("", request.getBaseUrl())
            : parsed.getData();
        ExtractedContent content = contentExtractor.extract(document);

        String language = StringUtils.isBlank(request.getLanguage())
            ? properties.getDefaultLanguage()
            : request.getLanguage().trim();
        String primaryKeyword = keywordNormalizer.normalize(request.getPrimaryKeyword());
        List<String> secondaryKeywords = keywordNormalizer.secondaryKeywords(primaryKeyword, request.getSecondaryKeywords());

        CompletableFuture<ReadabilityReport> readability = submit(
            () -> readabilityScorer.score(content.getParagraphText(), content.getParagraphs(), language));
        CompletableFuture<KeywordAnalysis> primary = submit(
            () -> primaryKeyword.isEmpty() ? null : keywordAnalyzer.analyze(primaryKeyword, document, content));
        CompletableFuture<List<KeywordAnalysis>> secondaries = submit(
            () -> analyzeSecondaryKeywords(secondaryKeywords, document, content));
        CompletableFuture<SchemaReport> schema = submit(() -> analyzeSchema(document));
        CompletableFuture<IntentProfile> intent = submit(
            () -> intentClassifier.analyze(primaryKeyword, request.getPostType(), content));

        awaitAll(readability, primary, secondaries, schema, intent);

        log.info("page analyzed, baseUrl={}, outcome={}, keyword={}",
            document.getBaseUrl(), parsed.getOutcome().getValue(), primaryKeyword);
        return AnalysisReport.builder()
            .outcome(parsed.getOutcome())
            .title(document.getTitle())
            .metaDescription(document.getMetaDescription())
            .baseUrl(document.getBaseUrl())
            .language(language)
            .content(summarize(content))
            .primaryKeyword(primary.get())
            .secondaryKeywords(secondaries.get())
            .keywordBalance(keywordAnalyzer.balance(primary.get(), secondaries.get()))
            .readability(readability.get())
            .schema(schema.get())
            .intent(intent.get())
            .build();
    }

    private List<KeywordAnalysis> analyzeSecondaryKeywords(List<String> keywords, PageDocument document,
                                                           ExtractedContent content) {
        List<KeywordAnalysis> analyses = new ArrayList<>();
        for (String keyword : keywords) {
            analyses.add(keywordAnalyzer.analyze(keyword, document, content));
        }
        return analyses;
    }

    private SchemaReport analyzeSchema(PageDocument document) {
        List<SchemaEntity> entities = schemaExtractor.extract(document);
        List<LocalBusinessCompleteness> localBusinesses = new ArrayList<>();
        for (SchemaEntity entity : localBusinessSchemaInspector.findLocalBusinesses(entities)) {
            localBusinesses.add(localBusinessSchemaInspector.inspect(entity));
        }
        return SchemaReport.builder()
            .types(schemaExtractor.extractTypes(entities))
            .entities(entities)
            .validation(schemaValidator.validateAll(entities))
            .localBusinesses(localBusinesses)
            .build();
    }

    private ContentSummary summarize(ExtractedContent content) {
        return ContentSummary.builder()
            .wordCount(TextUtils.countWords(content.getPlainText()))
            .paragraphCount(content.getParagraphs().size())
            .headingCount(content.getHeadings().size())
            .firstParagraph(content.getFirstParagraph())
            .headings(content.getHeadings())
            .fallbackUsed(content.isFallbackUsed())
            .build();
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, analysisExecutor);
    }

    private void awaitAll(CompletableFuture<?>... futures) throws Exception {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures);
        try {
            all.get(properties.getAnalysisTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            for (CompletableFuture<?> future : futures) {
                future.cancel(true);
            }
            throw new IllegalStateException("analysis timed out after " + properties.getAnalysisTimeoutMs() + "ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("analysis interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw new IllegalStateException("analysis failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public SiteKeywordResponse analyzeSite(List<KeywordMapEntry> entries, Double similarityThreshold) {
        long startAt = System.currentTimeMillis();
        try {
            if (entries == null) {
                throw new IllegalArgumentException("keyword map is null");
            }
            double threshold = similarityThreshold == null
                ? properties.getCannibalizationThreshold()
                : similarityThreshold;
            SiteKeywordReport report = SiteKeywordReport.builder()
                .totalDocuments(entries.size())
                .similarityThreshold(threshold)
                .issues(cannibalizationDetector.detect(entries, threshold))
                .coverage(keywordCoverageAnalyzer.analyze(entries))
                .clusters(topicClusterBuilder.build(entries, properties.getClusterSimilarityThreshold()))
                .build();
            log.info("site keywords analyzed, documents={}, issues={}", entries.size(), report.getIssues().size());
            return SiteKeywordResponse.builder()
                .statusCode(200)
                .report(report)
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (IllegalArgumentException ex) {
            log.warn("site keyword request invalid, error={}", ex.getMessage());
            return SiteKeywordResponse.builder()
                .statusCode(400)
                .error(ex.getMessage())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (Exception ex) {
            log.warn("site keyword analysis failed, documents={}, error={}", entries == null ? 0 : entries.size(), ex.getMessage(), ex);
            return SiteKeywordResponse.builder()
                .statusCode(500)
                .error(ex.getMessage())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        }
    }

}
