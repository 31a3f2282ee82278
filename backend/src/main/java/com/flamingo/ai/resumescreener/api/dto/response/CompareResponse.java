package com.flamingo.ai.resumescreener.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a side-by-side comparison. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompareResponse {

  private List<ScreenedCandidateResponse> candidates;
}
