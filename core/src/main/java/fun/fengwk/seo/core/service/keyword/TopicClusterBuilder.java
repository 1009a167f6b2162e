package fun.fengwk.seo.core.service.keyword;

import fun.fengwk.seo.core.service.keyword.model.ClusterPage;
import fun.fengwk.seo.core.service.keyword.model.KeywordMapEntry;
import fun.fengwk.seo.core.service.keyword.model.TopicCluster;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Groups documents into pillar/supporting clusters.
 *
 * <p>A document supports a pillar when their primary keywords are similar enough or they share a secondary
 * keyword. Each distinct primary keyword forms at most one cluster, and clusters without supporting pages are
 * dropped.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class TopicClusterBuilder {

    private final KeywordNormalizer keywordNormalizer;
    private final KeywordSimilarity keywordSimilarity;

    public List<TopicCluster> build(List<KeywordMapEntry> entries, double similarityThreshold) {
        List<TopicCluster> clusters = new ArrayList<>();
        if (entries == null) {
            return clusters;
        }
        Set<String> processed = new HashSet<>();
        for (KeywordMapEntry pillar : entries) {
            if (pillar == null) {
                continue;
            }
            String primary = keywordNormalizer.normalize(pillar.getPrimaryKeyword());
            if (primary.isEmpty() || !processed.add(primary)) {
                continue;
            }
            List<String> pillarSecondaries = keywordNormalizer.secondaryKeywords(primary, pillar.getSecondaryKeywords());
            List<ClusterPage> supporting = new ArrayList<>();
            for (KeywordMapEntry candidate : entries) {
                if (candidate == null || Objects.equals(candidate.getDocumentId(), pillar.getDocumentId())) {
                    continue;
                }
                if (isRelated(primary, pillarSecondaries, candidate, similarityThreshold)) {
                    supporting.add(page(candidate));
                }
            }
            if (!supporting.isEmpty()) {
                clusters.add(TopicCluster.builder()
                    .mainTopic(primary)
                    .pillarPage(page(pillar))
                    .supportingPages(supporting)
                    .relatedKeywords(pillarSecondaries)
                    .build());
            }
        }
        return clusters;
    }

    private boolean isRelated(String primary, List<String> pillarSecondaries, KeywordMapEntry candidate,
                              double similarityThreshold) {
        String candidatePrimary = keywordNormalizer.normalize(candidate.getPrimaryKeyword());
        if (!candidatePrimary.isEmpty() && keywordSimilarity.similarity(primary, candidatePrimary) >= similarityThreshold) {
            return true;
        }
        List<String> candidateSecondaries = keywordNormalizer.secondaryKeywords(candidatePrimary, candidate.getSecondaryKeywords());
        return pillarSecondaries.stream().anyMatch(candidateSecondaries::contains);
    }

    private ClusterPage page(KeywordMapEntry entry) {
        return new ClusterPage(entry.getDocumentId(), entry.getTitle(), entry.getUrl(),
            keywordNormalizer.normalize(entry.getPrimaryKeyword()));
    }

}
