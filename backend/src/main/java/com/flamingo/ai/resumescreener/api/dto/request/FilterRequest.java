package com.flamingo.ai.resumescreener.api.dto.request;

import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO carrying recruiter screening criteria. Range and name checks happen when the
 * criteria are turned into a requirement set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterRequest {

  @Size(max = 200, message = "At most 200 skills may be required")
  private List<String> skills;

  private Double minExperience;

  /** Minimum education level, e.g. {@code bachelor}. Blank means no constraint. */
  private String education;

  @Size(max = 200, message = "At most 200 keywords may be required")
  private List<String> keywords;

  private Double minScore;

  /** {@code strict} (default) or {@code ranking}, case-insensitive. */
  private String mode;
}
