package com.flamingo.ai.resumescreener.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a filter run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterResponse {

  private List<ScreenedCandidateResponse> candidates;
  private int total;

  /** Set when there is nothing to screen yet. */
  private String message;
}
