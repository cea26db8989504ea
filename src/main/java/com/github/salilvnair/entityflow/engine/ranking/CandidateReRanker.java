package com.github.salilvnair.entityflow.engine.ranking;

import com.github.salilvnair.entityflow.engine.model.Candidate;

import java.util.List;

/**
 * Optional replacement for the heuristic ordering. Output is re-normalized by
 * {@link DuplicateRanker}: scores are clamped to 0..100, low scores are dropped and the
 * list is sorted and truncated exactly like heuristic output.
 */
public interface CandidateReRanker {

    List<Candidate> rerank(String identifier, List<Candidate> candidates);
}
