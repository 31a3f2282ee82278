package com.flamingo.ai.resumescreener.service.scoring;

import com.flamingo.ai.resumescreener.config.ScreeningConfig;
import com.flamingo.ai.resumescreener.domain.model.MatchResult;
import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import com.flamingo.ai.resumescreener.domain.model.RequirementSet;
import com.flamingo.ai.resumescreener.domain.model.SubScores;
import com.flamingo.ai.resumescreener.service.extraction.VocabularyIndex;
import com.flamingo.ai.resumescreener.service.extraction.VocabularyMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Compares a profile against a requirement set and computes the weighted match score.
 *
 * <p>The score is {@code sum(weight * subScore) / sum(weight)} over four categories: skill
 * coverage, keyword coverage, experience (all or nothing) and education (all or nothing). A
 * category without a constraint gets full credit, so an empty requirement set scores 100.
 *
 * <p>A required token the vocabulary knows is looked up in the profile's extracted tokens. A token
 * outside the vocabulary is searched for as a whole token in the profile text instead, so custom
 * recruiter terms still match.
 */
@Component
@Slf4j
public class MatchScorer {

  private static final double FULL_CREDIT = 100.0;

  private final VocabularyIndex vocabularyIndex;
  private final ScreeningConfig.Scoring.Weights weights;

  public MatchScorer(VocabularyIndex vocabularyIndex, ScreeningConfig screeningConfig) {
    this.vocabularyIndex = vocabularyIndex;
    this.weights = screeningConfig.getScoring().getWeights();
    validateWeights(weights);
  }

  /**
   * Scores one profile. The returned result carries no decision yet.
   *
   * @param profile the candidate profile
   * @param requirements the screening criteria
   * @return matched/missing partitions, requirement checks and the score
   */
  public MatchResult score(ParsedProfile profile, RequirementSet requirements) {
    List<String> skillsMatched = new ArrayList<>();
    List<String> skillsMissing = new ArrayList<>();
    partition(
        requirements.requiredSkills(),
        profile.skills(),
        profile.rawText(),
        vocabularyIndex.skills(),
        skillsMatched,
        skillsMissing);

    List<String> keywordsMatched = new ArrayList<>();
    List<String> keywordsMissing = new ArrayList<>();
    partition(
        requirements.requiredKeywords(),
        profile.keywords(),
        profile.rawText(),
        vocabularyIndex.keywords(),
        keywordsMatched,
        keywordsMissing);

    boolean experienceOk =
        !requirements.hasMinExperience()
            || profile.totalExperienceYears() >= requirements.minExperienceYears();
    boolean educationOk =
        !requirements.hasMinEducation()
            || profile.educationFoundLevel().isAtLeast(requirements.minEducationLevel());

    SubScores subScores =
        new SubScores(
            coverage(skillsMatched.size(), requirements.requiredSkills().size()),
            coverage(keywordsMatched.size(), requirements.requiredKeywords().size()),
            experienceOk ? FULL_CREDIT : 0.0,
            educationOk ? FULL_CREDIT : 0.0);

    return new MatchResult(
        skillsMatched,
        skillsMissing,
        keywordsMatched,
        keywordsMissing,
        profile.totalExperienceYears(),
        experienceOk,
        profile.educationFoundLevel(),
        educationOk,
        subScores,
        weightedScore(subScores),
        null);
  }

  private void partition(
      Set<String> required,
      Set<String> extracted,
      String text,
      VocabularyMatcher<String> vocabulary,
      List<String> matched,
      List<String> missing) {
    for (String token : required) {
      boolean present =
          vocabulary
              .canonicalize(token)
              .map(extracted::contains)
              .orElseGet(() -> VocabularyMatcher.containsToken(text, token));
      (present ? matched : missing).add(token);
    }
  }

  private double coverage(int matched, int required) {
    if (required == 0) {
      return FULL_CREDIT;
    }
    return FULL_CREDIT * matched / Math.max(1, required);
  }

  private double weightedScore(SubScores subScores) {
    double weighted =
        weights.getSkills() * subScores.skills()
            + weights.getKeywords() * subScores.keywords()
            + weights.getExperience() * subScores.experience()
            + weights.getEducation() * subScores.education();
    double score = Math.min(FULL_CREDIT, Math.max(0.0, weighted / weights.total()));
    return Math.round(score * 100.0) / 100.0;
  }

  private static void validateWeights(ScreeningConfig.Scoring.Weights weights) {
    if (weights.getSkills() < 0
        || weights.getKeywords() < 0
        || weights.getExperience() < 0
        || weights.getEducation() < 0
        || !(weights.total() > 0)) {
      throw new IllegalStateException(
          "screening.scoring.weights must be non-negative with a positive sum");
    }
    log.info(
        "Scoring weights: skills={}, keywords={}, experience={}, education={}",
        weights.getSkills(),
        weights.getKeywords(),
        weights.getExperience(),
        weights.getEducation());
  }
}
