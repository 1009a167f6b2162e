package fun.fengwk.seo.core.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.seo.core.service.common.LanguageWordLists;
import fun.fengwk.seo.core.service.content.BoilerplateRules;
import fun.fengwk.seo.core.service.intent.IntentPatterns;
import fun.fengwk.seo.core.service.schema.SchemaRules;
import fun.fengwk.seo.core.service.schema.SchemaTypeHierarchy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Static analysis tables and the analysis executor.
 *
 * @author fengwk
 */
@Slf4j
@Configuration
public class SeoAnalysisConfiguration {

    // the stdio server runs without spring-web, which is where boot's jackson mapper comes from
    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public LanguageWordLists languageWordLists(ObjectMapper objectMapper) {
        LanguageWordLists wordLists = LanguageWordLists.load(objectMapper, LanguageWordLists.DEFAULT_RESOURCE);
        log.info("word lists loaded, stopWordLanguages={}, transitionWordLanguages={}",
            wordLists.getStopWords().keySet(), wordLists.getTransitionWords().keySet());
        return wordLists;
    }

    @Bean
    public BoilerplateRules boilerplateRules() {
        return BoilerplateRules.defaults();
    }

    @Bean
    public SchemaRules schemaRules() {
        return SchemaRules.defaults();
    }

    @Bean
    public SchemaTypeHierarchy schemaTypeHierarchy() {
        return SchemaTypeHierarchy.defaults();
    }

    @Bean
    public IntentPatterns intentPatterns() {
        return IntentPatterns.defaults();
    }

    @Bean(name = "seoAnalysisExecutor", destroyMethod = "shutdownNow")
    public ExecutorService seoAnalysisExecutor(SeoAnalysisProperties properties) {
        int threads = Math.max(1, properties.getAnalysisThreads());
        AtomicInteger threadIdGen = new AtomicInteger(1);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("seo-analysis-worker-" + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, threadFactory);
    }

}
