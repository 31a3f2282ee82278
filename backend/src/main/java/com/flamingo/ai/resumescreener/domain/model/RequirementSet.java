package com.flamingo.ai.resumescreener.domain.model;

import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;
import com.flamingo.ai.resumescreener.domain.enums.MatchingMode;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Builder;

/**
 * Normalized screening criteria for a single filter, compare or export request.
 *
 * <p>Empty sets and {@code null} thresholds mean "no constraint". Build instances through {@link
 * com.flamingo.ai.resumescreener.service.scoring.RequirementSetFactory} when the input comes from a
 * user, so tokens are canonicalized and thresholds validated.
 */
@Builder
public record RequirementSet(
    Set<String> requiredSkills,
    Double minExperienceYears,
    EducationLevel minEducationLevel,
    Set<String> requiredKeywords,
    Double minScore,
    MatchingMode mode) {

  public RequirementSet {
    requiredSkills = orderedCopy(requiredSkills);
    requiredKeywords = orderedCopy(requiredKeywords);
    mode = mode == null ? MatchingMode.STRICT : mode;
  }

  /** A requirement set with no constraints at all, in strict mode. */
  public static RequirementSet unconstrained() {
    return RequirementSet.builder().build();
  }

  public boolean hasMinExperience() {
    return minExperienceYears != null;
  }

  public boolean hasMinEducation() {
    return minEducationLevel != null;
  }

  public boolean hasMinScore() {
    return minScore != null;
  }

  private static Set<String> orderedCopy(Set<String> source) {
    if (source == null || source.isEmpty()) {
      return Set.of();
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(source));
  }
}
