package io.github.jakubt4.kaal.muhurta;

import java.util.List;

/**
 * Ranked outcome of a search.
 *
 * @param samplesPlanned   samples on the grid
 * @param samplesSkipped   samples dropped because they overlap a caller-excluded period
 * @param samplesEvaluated samples actually scored
 * @param partial          the time budget expired before every sample was scored
 */
public record MuhurtaSearchResult(EventType eventType,
                                  List<MuhurtaCandidate> candidates,
                                  int samplesPlanned,
                                  int samplesSkipped,
                                  int samplesEvaluated,
                                  boolean partial,
                                  String ruleSetVersion) {

    public MuhurtaSearchResult {
        candidates = List.copyOf(candidates);
    }
}
