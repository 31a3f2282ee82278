package com.flamingo.ai.resumescreener.api.rest;

import com.flamingo.ai.resumescreener.api.dto.request.CompareRequest;
import com.flamingo.ai.resumescreener.api.dto.request.FilterRequest;
import com.flamingo.ai.resumescreener.api.dto.request.TextUploadRequest;
import com.flamingo.ai.resumescreener.api.dto.response.CandidateSummaryResponse;
import com.flamingo.ai.resumescreener.api.dto.response.ClearResponse;
import com.flamingo.ai.resumescreener.api.dto.response.CompareResponse;
import com.flamingo.ai.resumescreener.api.dto.response.FilterResponse;
import com.flamingo.ai.resumescreener.api.dto.response.ScreenedCandidateResponse;
import com.flamingo.ai.resumescreener.api.dto.response.UploadResponse;
import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import com.flamingo.ai.resumescreener.domain.model.RequirementSet;
import com.flamingo.ai.resumescreener.domain.model.ScreenedCandidate;
import com.flamingo.ai.resumescreener.domain.model.SourceDocument;
import com.flamingo.ai.resumescreener.service.export.CsvExportService;
import com.flamingo.ai.resumescreener.service.scoring.RequirementSetFactory;
import com.flamingo.ai.resumescreener.service.screening.ScreeningService;
import jakarta.validation.Valid;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for candidate upload and screening. */
@RestController
@RequestMapping("/api/candidates")
@RequiredArgsConstructor
public class CandidateController {

  static final String NO_CANDIDATES_MESSAGE = "No resumes uploaded yet.";
  static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

  private final ScreeningService screeningService;
  private final RequirementSetFactory requirementSetFactory;
  private final CsvExportService csvExportService;

  /** Uploads a batch of resume documents. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> upload(@RequestParam("files") List<MultipartFile> files) {
    List<ParsedProfile> profiles = screeningService.upload(files);
    return ResponseEntity.status(HttpStatus.CREATED).body(toUploadResponse(profiles));
  }

  /** Uploads a resume whose text was decoded elsewhere. */
  @PostMapping(value = "/text", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<UploadResponse> uploadText(@Valid @RequestBody TextUploadRequest request) {
    List<ParsedProfile> profiles =
        screeningService.ingest(
            List.of(new SourceDocument(request.getFilename(), request.getText())));
    return ResponseEntity.status(HttpStatus.CREATED).body(toUploadResponse(profiles));
  }

  /** Lists stored candidates in upload order. */
  @GetMapping
  public ResponseEntity<List<CandidateSummaryResponse>> getCandidates() {
    return ResponseEntity.ok(
        screeningService.getCandidates().stream()
            .map(CandidateSummaryResponse::fromProfile)
            .toList());
  }

  /** Scores all stored candidates against the criteria. */
  @PostMapping("/filter")
  public ResponseEntity<FilterResponse> filter(@Valid @RequestBody FilterRequest request) {
    RequirementSet requirements = toRequirements(request);
    if (screeningService.countCandidates() == 0) {
      return ResponseEntity.ok(
          FilterResponse.builder()
              .candidates(List.of())
              .total(0)
              .message(NO_CANDIDATES_MESSAGE)
              .build());
    }
    List<ScreenedCandidateResponse> candidates = toResponses(screeningService.filter(requirements));
    return ResponseEntity.ok(
        FilterResponse.builder().candidates(candidates).total(candidates.size()).build());
  }

  /** Runs the same filter and returns the shortlist as a CSV download. */
  @PostMapping("/export")
  public ResponseEntity<String> export(@Valid @RequestBody FilterRequest request) {
    List<ScreenedCandidate> candidates = screeningService.filter(toRequirements(request));
    String csv = csvExportService.export(candidates);
    return ResponseEntity.ok()
        .contentType(TEXT_CSV)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            "attachment; filename=" + csvExportService.exportFileName())
        .body(csv);
  }

  /** Compares selected candidates side by side. */
  @PostMapping("/compare")
  public ResponseEntity<CompareResponse> compare(@Valid @RequestBody CompareRequest request) {
    List<ScreenedCandidate> candidates =
        screeningService.compare(request.getIds(), toRequirements(request));
    return ResponseEntity.ok(new CompareResponse(toResponses(candidates)));
  }

  /** Removes every stored candidate. */
  @PostMapping("/clear")
  public ResponseEntity<ClearResponse> clear() {
    int removed = screeningService.clear();
    return ResponseEntity.ok(new ClearResponse(true, removed, screeningService.countCandidates()));
  }

  private RequirementSet toRequirements(FilterRequest request) {
    return requirementSetFactory.create(
        request.getSkills(),
        request.getMinExperience(),
        request.getEducation(),
        request.getKeywords(),
        request.getMinScore(),
        request.getMode());
  }

  private UploadResponse toUploadResponse(List<ParsedProfile> profiles) {
    return UploadResponse.builder()
        .uploaded(profiles.stream().map(CandidateSummaryResponse::fromProfile).toList())
        .totalStored(screeningService.countCandidates())
        .build();
  }

  private List<ScreenedCandidateResponse> toResponses(List<ScreenedCandidate> candidates) {
    return candidates.stream().map(ScreenedCandidateResponse::fromCandidate).toList();
  }
}
