package com.github.salilvnair.entityflow.engine.ranking;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.entityflow.config.EntityFlowProperties;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import com.github.salilvnair.entityflow.engine.model.Candidate;
import com.github.salilvnair.entityflow.llm.core.TextCompleter;
import com.github.salilvnair.entityflow.prompt.PromptTemplates;
import com.github.salilvnair.entityflow.template.ThymeleafTemplateRenderer;
import com.github.salilvnair.entityflow.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the completion provider to score the heuristic candidates. Ids the provider invents
 * are ignored; candidates it leaves out keep their heuristic score.
 */
@Slf4j
@RequiredArgsConstructor
public class AiCandidateReRanker implements CandidateReRanker {

    private final TextCompleter completer;
    private final ThymeleafTemplateRenderer renderer;
    private final EntityFlowProperties.Completer settings;

    @Override
    public List<Candidate> rerank(String identifier, List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            return candidates;
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        Map<String, Candidate> byId = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            String id = String.valueOf(candidate.id());
            byId.put(id, candidate);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", id);
            row.put("label", candidate.matchedValue());
            rows.add(row);
        }
        String prompt = renderer.render(PromptTemplates.RERANK_CANDIDATES,
                Map.of("identifier", identifier, "candidates", rows));
        JsonNode reply = JsonUtil.parseOrNull(completer.complete(prompt, settings.getMaxTokens(), settings.getTemperature()));
        JsonNode ranking = reply == null ? null : reply.path("ranking");
        if (ranking == null || !ranking.isArray() || ranking.isEmpty()) {
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_INVALID_RESPONSE, "Re-ranking reply had no ranking array");
        }
        Map<String, Candidate> rescored = new LinkedHashMap<>();
        for (JsonNode entry : ranking) {
            String id = entry.path("id").asText(null);
            Candidate candidate = id == null ? null : byId.get(id);
            if (candidate == null || !entry.path("score").isNumber()) {
                log.debug("Ignoring re-ranking entry {}", entry);
                continue;
            }
            rescored.put(id, candidate.withScore(entry.path("score").asInt()));
        }
        if (rescored.isEmpty()) {
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_INVALID_RESPONSE, "Re-ranking reply named no known candidate");
        }
        List<Candidate> result = new ArrayList<>(rescored.values());
        byId.forEach((id, candidate) -> {
            if (!rescored.containsKey(id)) {
                result.add(candidate);
            }
        });
        return result;
    }
}
