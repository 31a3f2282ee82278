package com.flamingo.ai.resumescreener.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a resume whose text was already decoded by an external extractor. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextUploadRequest {

  @NotBlank(message = "Filename is required")
  @Size(max = 255, message = "Filename must not exceed 255 characters")
  private String filename;

  @NotNull(message = "Text is required")
  private String text;
}
