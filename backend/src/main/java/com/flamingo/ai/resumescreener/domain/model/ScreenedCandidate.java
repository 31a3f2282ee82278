package com.flamingo.ai.resumescreener.domain.model;

/** A stored profile together with its decided match result for one request. */
public record ScreenedCandidate(
    ParsedProfile profile, MatchResult result, RequirementSet requirements) {

  public double score() {
    return result.score();
  }

  public boolean passed() {
    return result.passed();
  }
}
