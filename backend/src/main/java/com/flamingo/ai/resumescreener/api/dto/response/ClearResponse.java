package com.flamingo.ai.resumescreener.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for clearing the candidate store. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClearResponse {

  private boolean ok;
  private int removed;
  private int totalStored;
}
