package com.flamingo.ai.resumescreener.domain.model;

import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;
import java.util.List;

/**
 * Comparison of one profile against one requirement set.
 *
 * <p>{@link com.flamingo.ai.resumescreener.service.scoring.MatchScorer} produces the result with
 * no decision attached; the decision engine's verdict is added with {@link #withDecision}. The
 * profile's experience and education are carried along so rejection reasons can quote them.
 */
public record MatchResult(
    List<String> skillsMatched,
    List<String> skillsMissing,
    List<String> keywordsMatched,
    List<String> keywordsMissing,
    double experienceYears,
    boolean experienceOk,
    EducationLevel educationFound,
    boolean educationOk,
    SubScores subScores,
    double score,
    Decision decision) {

  public MatchResult {
    skillsMatched = List.copyOf(skillsMatched);
    skillsMissing = List.copyOf(skillsMissing);
    keywordsMatched = List.copyOf(keywordsMatched);
    keywordsMissing = List.copyOf(keywordsMissing);
  }

  public MatchResult withDecision(Decision newDecision) {
    return new MatchResult(
        skillsMatched,
        skillsMissing,
        keywordsMatched,
        keywordsMissing,
        experienceYears,
        experienceOk,
        educationFound,
        educationOk,
        subScores,
        score,
        newDecision);
  }

  public boolean isDecided() {
    return decision != null;
  }

  public boolean passed() {
    return decision != null && decision.passed();
  }

  public List<String> rejectReasons() {
    return decision == null ? List.of() : decision.reasons();
  }
}
