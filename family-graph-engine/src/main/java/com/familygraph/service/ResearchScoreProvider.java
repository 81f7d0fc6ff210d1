package com.familygraph.service;

import com.familygraph.model.ResearchScores;

import java.util.Optional;

/**
 * Supplies coverage and conflict figures kept by a research-tracking system.
 */
public interface ResearchScoreProvider {

    Optional<ResearchScores> scoresFor(String personId);

    static ResearchScoreProvider none() {
        return personId -> Optional.empty();
    }
}
