package com.flamingo.ai.resumescreener.service.scoring;

import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;
import com.flamingo.ai.resumescreener.domain.enums.MatchingMode;
import com.flamingo.ai.resumescreener.domain.model.RequirementSet;
import com.flamingo.ai.resumescreener.exception.InvalidRequirementException;
import com.flamingo.ai.resumescreener.service.extraction.VocabularyIndex;
import com.flamingo.ai.resumescreener.service.extraction.VocabularyMatcher;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Validates raw recruiter criteria and normalizes them into a {@link RequirementSet}.
 *
 * <p>Tokens are trimmed, lower-cased and de-duplicated; known vocabulary variants are mapped to
 * their canonical token so "NodeJS" and "node.js" require the same skill.
 */
@Component
@RequiredArgsConstructor
public class RequirementSetFactory {

  private final VocabularyIndex vocabularyIndex;

  /**
   * Builds a requirement set.
   *
   * @param skills required skills, may be {@code null}
   * @param minExperienceYears minimum years of experience, {@code null} for no constraint
   * @param education minimum education level name, blank for no constraint
   * @param keywords required keywords, may be {@code null}
   * @param minScore minimum score percentage, {@code null} for no constraint
   * @param mode {@code strict} or {@code ranking}, blank for strict
   * @return the normalized requirement set
   * @throws InvalidRequirementException if a threshold is out of range or a name is unknown
   */
  public RequirementSet create(
      Collection<String> skills,
      Double minExperienceYears,
      String education,
      Collection<String> keywords,
      Double minScore,
      String mode) {

    if (minExperienceYears != null
        && !(Double.isFinite(minExperienceYears) && minExperienceYears >= 0)) {
      throw new InvalidRequirementException(
          "minExperience", "Minimum experience must be a non-negative number");
    }
    if (minScore != null && (minScore.isNaN() || minScore < 0 || minScore > 100)) {
      throw new InvalidRequirementException("minScore", "Minimum score must be between 0 and 100");
    }

    MatchingMode matchingMode = MatchingMode.STRICT;
    if (mode != null && !mode.isBlank()) {
      matchingMode =
          MatchingMode.fromValue(mode)
              .orElseThrow(
                  () ->
                      new InvalidRequirementException(
                          "mode", "Unknown matching mode '" + mode + "', use strict or ranking"));
    }

    EducationLevel educationLevel = null;
    if (education != null && !education.isBlank()) {
      educationLevel =
          EducationLevel.fromValue(education)
              .orElseThrow(
                  () ->
                      new InvalidRequirementException(
                          "education", "Unknown education level '" + education + "'"));
    }

    return RequirementSet.builder()
        .requiredSkills(canonicalTokens(skills, vocabularyIndex.skills()))
        .minExperienceYears(minExperienceYears)
        .minEducationLevel(educationLevel)
        .requiredKeywords(canonicalTokens(keywords, vocabularyIndex.keywords()))
        .minScore(minScore)
        .mode(matchingMode)
        .build();
  }

  private Set<String> canonicalTokens(
      Collection<String> tokens, VocabularyMatcher<String> vocabulary) {
    Set<String> result = new LinkedHashSet<>();
    if (tokens == null) {
      return result;
    }
    for (String token : tokens) {
      if (token == null || token.isBlank()) {
        continue;
      }
      String cleaned = token.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
      result.add(vocabulary.canonicalize(cleaned).orElse(cleaned));
    }
    return result;
  }
}
