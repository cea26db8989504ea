package com.github.salilvnair.entityflow.engine.ranking;

import com.github.salilvnair.entityflow.config.EntityFlowProperties;
import com.github.salilvnair.entityflow.engine.model.Candidate;
import com.github.salilvnair.entityflow.engine.model.ResolutionConfig;
import com.github.salilvnair.entityflow.store.EntityQuery;
import com.github.salilvnair.entityflow.store.EntityRecord;
import com.github.salilvnair.entityflow.store.EntityStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class DuplicateRanker {

    private final SimilarityScorer scorer;
    private final EntityFlowProperties.Ranking ranking;
    private final Optional<CandidateReRanker> reRanker;

    public DuplicateRanker(SimilarityScorer scorer, EntityFlowProperties properties, Optional<CandidateReRanker> reRanker) {
        this.scorer = scorer;
        this.ranking = properties.getRanking();
        this.reRanker = reRanker;
    }

    /**
     * Wide substring search followed by scoring. Returns at most top-k candidates, best first.
     */
    public List<Candidate> findSimilar(EntityStore store, ResolutionConfig config, String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return List.of();
        }
        List<String> searchFields = config.effectiveSearchFields();
        List<EntityRecord> wide = store.findMany(
                EntityQuery.contains(config.getFilters(), searchFields, identifier),
                ranking.getCandidateLimit());
        if (wide.isEmpty()) {
            return List.of();
        }
        List<Candidate> scored = score(identifier, wide, searchFields);
        if (reRanker.isPresent()) {
            try {
                return normalize(reRanker.get().rerank(identifier, scored));
            } catch (RuntimeException e) {
                log.warn("Candidate re-ranking failed for '{}', using heuristic order: {}", identifier, e.getMessage());
            }
        }
        return normalize(scored);
    }

    public List<Candidate> rank(String identifier, List<EntityRecord> records, List<String> searchFields) {
        return normalize(score(identifier, records, searchFields));
    }

    List<Candidate> score(String identifier, List<EntityRecord> records, List<String> searchFields) {
        List<Candidate> scored = new ArrayList<>();
        for (EntityRecord entity : records) {
            int best = -1;
            String matchedField = null;
            for (String field : searchFields) {
                String value = entity.text(field);
                if (value == null) {
                    continue;
                }
                int score = scorer.calculate(identifier, value);
                if (score > best) {
                    best = score;
                    matchedField = field;
                }
            }
            if (matchedField != null) {
                scored.add(new Candidate(entity.id(), entity.asMap(), best, matchedField));
            }
        }
        return scored;
    }

    List<Candidate> normalize(List<Candidate> candidates) {
        if (candidates == null) {
            return List.of();
        }
        return candidates.stream()
                .filter(c -> c.similarityScore() >= ranking.getMinScore())
                .sorted(Comparator.comparingInt(Candidate::similarityScore).reversed())
                .limit(ranking.getTopK())
                .toList();
    }
}
