package com.flamingo.ai.resumescreener.api.rest;

import com.flamingo.ai.resumescreener.api.dto.response.JobDescriptionResponse;
import com.flamingo.ai.resumescreener.service.screening.ScreeningService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller deriving filter defaults from a job description. */
@RestController
@RequestMapping("/api/job-descriptions")
@RequiredArgsConstructor
public class JobDescriptionController {

  private final ScreeningService screeningService;

  /** Extracts required skills, experience, education and keywords from an uploaded JD. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<JobDescriptionResponse> extract(@RequestParam("file") MultipartFile file) {
    return ResponseEntity.ok(
        JobDescriptionResponse.fromAnalysis(screeningService.extractRequirements(file)));
  }
}
