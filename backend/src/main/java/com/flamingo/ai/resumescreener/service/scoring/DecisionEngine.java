package com.flamingo.ai.resumescreener.service.scoring;

import com.flamingo.ai.resumescreener.domain.enums.MatchingMode;
import com.flamingo.ai.resumescreener.domain.model.Decision;
import com.flamingo.ai.resumescreener.domain.model.MatchResult;
import com.flamingo.ai.resumescreener.domain.model.RequirementSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Applies the pass/reject policy of the requested {@link MatchingMode}.
 *
 * <p>{@link MatchingMode#STRICT} rejects on any missing skill, on an experience or education
 * shortfall and on a score under the threshold, with one reason per failed check. {@link
 * MatchingMode#RANKING} only applies the score threshold. Missing keywords lower the score but
 * never reject on their own.
 */
@Component
public class DecisionEngine {

  public static final String MISSING_SKILL = "missing required skill: ";
  public static final String EXPERIENCE_BELOW_MINIMUM = "experience below minimum";
  public static final String EDUCATION_BELOW_MINIMUM = "education below minimum";
  public static final String SCORE_BELOW_THRESHOLD = "score below threshold";

  /**
   * Decides a scored result.
   *
   * @param result output of {@link MatchScorer#score}
   * @param requirements the requirement set the result was scored against
   * @return the decision, with reasons in check order
   */
  public Decision decide(MatchResult result, RequirementSet requirements) {
    List<String> reasons = new ArrayList<>();

    if (requirements.mode() == MatchingMode.STRICT) {
      result.skillsMissing().forEach(skill -> reasons.add(MISSING_SKILL + skill));
      if (!result.experienceOk()) {
        reasons.add(
            String.format(
                Locale.ROOT,
                "%s: %s years (requires %s)",
                EXPERIENCE_BELOW_MINIMUM,
                formatNumber(result.experienceYears()),
                formatNumber(requirements.minExperienceYears())));
      }
      if (!result.educationOk()) {
        reasons.add(
            String.format(
                Locale.ROOT,
                "%s: %s (requires %s)",
                EDUCATION_BELOW_MINIMUM,
                result.educationFound().wireName(),
                requirements.minEducationLevel().wireName()));
      }
    }

    if (requirements.hasMinScore() && result.score() < requirements.minScore()) {
      reasons.add(
          String.format(
              Locale.ROOT,
              "%s: %.2f (requires %.2f)",
              SCORE_BELOW_THRESHOLD,
              result.score(),
              requirements.minScore()));
    }

    return reasons.isEmpty() ? Decision.pass() : Decision.reject(reasons);
  }

  private static String formatNumber(double value) {
    return String.format(Locale.ROOT, "%.1f", value);
  }
}
