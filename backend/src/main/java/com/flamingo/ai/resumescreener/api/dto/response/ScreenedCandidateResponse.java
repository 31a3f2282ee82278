package com.flamingo.ai.resumescreener.api.dto.response;

import com.flamingo.ai.resumescreener.domain.model.MatchResult;
import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import com.flamingo.ai.resumescreener.domain.model.RequirementSet;
import com.flamingo.ai.resumescreener.domain.model.ScreenedCandidate;
import com.flamingo.ai.resumescreener.domain.model.SubScores;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO merging a candidate profile with its match result. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreenedCandidateResponse {

  private String id;
  private String filename;
  private String storedFileName;
  private List<String> email;
  private List<String> phone;
  private List<String> skillsDetected;
  private List<String> skillsRequired;
  private List<String> skillsMatched;
  private List<String> skillsMissing;
  private double totalExperienceYears;
  private String educationRequired;
  private String educationFoundLevel;
  private List<String> keywordsRequired;
  private List<String> keywordsMatched;
  private List<String> keywordsMissing;
  private double score;
  private boolean passed;
  private List<String> rejectReasons;
  private String modeUsed;

  /** Per-category credit, 0 to 100, behind the score. */
  private Weights weights;

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Weights {
    private double skills;
    private double experience;
    private double education;
    private double keywords;

    static Weights fromSubScores(SubScores subScores) {
      return new Weights(
          subScores.skills(), subScores.experience(), subScores.education(), subScores.keywords());
    }
  }

  /** Creates a ScreenedCandidateResponse from a screened candidate. */
  public static ScreenedCandidateResponse fromCandidate(ScreenedCandidate candidate) {
    ParsedProfile profile = candidate.profile();
    MatchResult result = candidate.result();
    RequirementSet requirements = candidate.requirements();
    return ScreenedCandidateResponse.builder()
        .id(profile.id())
        .filename(profile.filename())
        .storedFileName(profile.storedFileName())
        .email(profile.emails())
        .phone(profile.phones())
        .skillsDetected(List.copyOf(profile.skills()))
        .skillsRequired(List.copyOf(requirements.requiredSkills()))
        .skillsMatched(result.skillsMatched())
        .skillsMissing(result.skillsMissing())
        .totalExperienceYears(profile.totalExperienceYears())
        .educationRequired(
            requirements.hasMinEducation() ? requirements.minEducationLevel().wireName() : null)
        .educationFoundLevel(profile.educationFoundLevel().wireName())
        .keywordsRequired(List.copyOf(requirements.requiredKeywords()))
        .keywordsMatched(result.keywordsMatched())
        .keywordsMissing(result.keywordsMissing())
        .score(result.score())
        .passed(result.passed())
        .rejectReasons(result.rejectReasons())
        .modeUsed(requirements.mode().wireName())
        .weights(Weights.fromSubScores(result.subScores()))
        .build();
  }
}
