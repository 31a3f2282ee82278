package com.flamingo.ai.resumescreener.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** Request DTO for a side-by-side comparison of selected candidates. */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CompareRequest extends FilterRequest {

  @NotNull(message = "Candidate ids are required")
  private List<String> ids;
}
