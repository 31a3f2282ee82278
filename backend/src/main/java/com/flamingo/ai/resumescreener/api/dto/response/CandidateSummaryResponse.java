package com.flamingo.ai.resumescreener.api.dto.response;

import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO summarizing a stored candidate profile. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateSummaryResponse {

  private String id;
  private String filename;
  private String storedFileName;
  private List<String> email;
  private List<String> phone;
  private List<String> skillsDetected;
  private List<String> keywordsDetected;
  private double totalExperienceYears;
  private String educationFoundLevel;
  private Instant uploadedAt;

  /** Creates a CandidateSummaryResponse from a parsed profile. */
  public static CandidateSummaryResponse fromProfile(ParsedProfile profile) {
    return CandidateSummaryResponse.builder()
        .id(profile.id())
        .filename(profile.filename())
        .storedFileName(profile.storedFileName())
        .email(profile.emails())
        .phone(profile.phones())
        .skillsDetected(List.copyOf(profile.skills()))
        .keywordsDetected(List.copyOf(profile.keywords()))
        .totalExperienceYears(profile.totalExperienceYears())
        .educationFoundLevel(profile.educationFoundLevel().wireName())
        .uploadedAt(profile.uploadedAt())
        .build();
  }
}
