package com.flamingo.ai.resumescreener.api.dto.response;

import com.flamingo.ai.resumescreener.domain.model.JobDescriptionAnalysis;
import com.flamingo.ai.resumescreener.domain.model.RequirementSet;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO with filter defaults derived from a job description. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDescriptionResponse {

  private String filename;
  private List<String> skills;
  private Double minExperience;
  private String education;
  private List<String> keywords;
  private String mode;
  private String rawText;

  /** Creates a JobDescriptionResponse from a job description analysis. */
  public static JobDescriptionResponse fromAnalysis(JobDescriptionAnalysis analysis) {
    RequirementSet requirements = analysis.requirements();
    return JobDescriptionResponse.builder()
        .filename(analysis.filename())
        .skills(List.copyOf(requirements.requiredSkills()))
        .minExperience(requirements.minExperienceYears())
        .education(
            requirements.hasMinEducation() ? requirements.minEducationLevel().wireName() : null)
        .keywords(List.copyOf(requirements.requiredKeywords()))
        .mode(requirements.mode().wireName())
        .rawText(analysis.rawTextPreview())
        .build();
  }
}
