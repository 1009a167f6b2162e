package fun.fengwk.seo.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thresholds and runtime settings for page analysis.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "seo.analysis")
public class SeoAnalysisProperties {

    /**
     * Lower bound (percent) of the density band counted as sufficient usage.
     */
    private double densityMin = 0.5D;

    /**
     * Upper bound (percent) of the density band counted as sufficient usage.
     */
    private double densityMax = 3.0D;

    /**
     * Lower bound (percent) of the competitive ideal density band.
     */
    private double idealDensityMin = 0.5D;

    /**
     * Upper bound (percent) of the competitive ideal density band.
     */
    private double idealDensityMax = 2.5D;

    /**
     * Density (percent) above which usage is severely overused.
     */
    private double severeOveruseDensity = 5.0D;

    /**
     * Density (percent) below which usage is severely underused.
     */
    private double severeUnderuseDensity = 0.1D;

    /**
     * First occurrence must fall within this share (percent) of the text.
     */
    private double maxFirstPositionPercent = 30D;

    /**
     * Minimum normalized spread between first and last occurrence.
     */
    private double minSpread = 0.1D;

    /**
     * Similarity score at which two primary keywords collide.
     */
    private double cannibalizationThreshold = 70D;

    /**
     * Similarity score at which two pages belong to one topic cluster.
     */
    private double clusterSimilarityThreshold = 40D;

    /**
     * Passive sentence share (percent) above which passive voice is flagged.
     */
    private double passiveVoiceThreshold = 10D;

    /**
     * Transition sentence share (percent) needed to pass.
     */
    private double transitionWordsThreshold = 30D;

    /**
     * Forced usage share (percent) at which keyword usage stops being natural.
     */
    private double forcedUsageThreshold = 30D;

    /**
     * Language used when a request does not name one.
     */
    private String defaultLanguage = "en";

    /**
     * Worker threads running analyzers of one page in parallel.
     */
    private int analysisThreads = 4;

    /**
     * Timeout for one page analysis.
     */
    private long analysisTimeoutMs = 30000L;

    /**
     * Larger html input is rejected.
     */
    private int maxHtmlLength = 5 * 1024 * 1024;

}
