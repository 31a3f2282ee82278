package com.flamingo.ai.resumescreener.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a batch upload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {

  private List<CandidateSummaryResponse> uploaded;
  private int totalStored;
}
