package com.flamingo.ai.resumescreener.api.rest;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.resumescreener.ScreeningFixtures;
import com.flamingo.ai.resumescreener.api.dto.request.CompareRequest;
import com.flamingo.ai.resumescreener.api.dto.request.FilterRequest;
import com.flamingo.ai.resumescreener.api.dto.request.TextUploadRequest;
import com.flamingo.ai.resumescreener.config.ScreeningConfig;
import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;
import com.flamingo.ai.resumescreener.domain.enums.MatchingMode;
import com.flamingo.ai.resumescreener.domain.model.MatchResult;
import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import com.flamingo.ai.resumescreener.domain.model.RequirementSet;
import com.flamingo.ai.resumescreener.domain.model.ScreenedCandidate;
import com.flamingo.ai.resumescreener.exception.ApiError;
import com.flamingo.ai.resumescreener.exception.DuplicateIdentifierException;
import com.flamingo.ai.resumescreener.exception.GlobalExceptionHandler;
import com.flamingo.ai.resumescreener.exception.InsufficientCandidatesException;
import com.flamingo.ai.resumescreener.exception.UnsupportedDocumentException;
import com.flamingo.ai.resumescreener.exception.UploadLimitExceededException;
import com.flamingo.ai.resumescreener.service.export.CsvExportService;
import com.flamingo.ai.resumescreener.service.scoring.DecisionEngine;
import com.flamingo.ai.resumescreener.service.scoring.MatchScorer;
import com.flamingo.ai.resumescreener.service.scoring.RequirementSetFactory;
import com.flamingo.ai.resumescreener.service.screening.ScreeningService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CandidateController Tests")
class CandidateControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private SimpleMeterRegistry meterRegistry;

  @Mock private ScreeningService screeningService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    CandidateController controller =
        new CandidateController(
            screeningService,
            new RequirementSetFactory(ScreeningFixtures.vocabularyIndex()),
            new CsvExportService(ScreeningFixtures.fixedClock()));
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  private static ScreenedCandidate screened(ParsedProfile profile, RequirementSet requirements) {
    MatchResult scored =
        new MatchScorer(ScreeningFixtures.vocabularyIndex(), new ScreeningConfig())
            .score(profile, requirements);
    return new ScreenedCandidate(
        profile,
        scored.withDecision(new DecisionEngine().decide(scored, requirements)),
        requirements);
  }

  private static FilterRequest filterRequest(String mode, String... skills) {
    FilterRequest request = new FilterRequest();
    request.setSkills(List.of(skills));
    request.setMode(mode);
    return request;
  }

  @Nested
  @DisplayName("Upload")
  class Upload {

    @Test
    @DisplayName("should return 201 with the stored candidates")
    void shouldReturnCreated() throws Exception {
      // Given
      ParsedProfile profile =
          ScreeningFixtures.profile("id-1", Set.of("python"), 3, EducationLevel.BACHELOR);
      when(screeningService.upload(anyList())).thenReturn(List.of(profile));
      when(screeningService.countCandidates()).thenReturn(1);

      // When / Then
      mockMvc
          .perform(
              multipart("/api/candidates/upload")
                  .file(
                      new MockMultipartFile(
                          "files", "id-1.txt", "text/plain", "python".getBytes(UTF_8))))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.totalStored").value(1))
          .andExpect(jsonPath("$.uploaded[0].id").value("id-1"))
          .andExpect(jsonPath("$.uploaded[0].skillsDetected[0]").value("python"))
          .andExpect(jsonPath("$.uploaded[0].educationFoundLevel").value("bachelor"));
    }

    @Test
    @DisplayName("should return 415 when no file is supported")
    void shouldReturnUnsupportedMediaType() throws Exception {
      when(screeningService.upload(anyList()))
          .thenThrow(new UnsupportedDocumentException(List.of("cv.pdf")));

      mockMvc
          .perform(
              multipart("/api/candidates/upload")
                  .file(new MockMultipartFile("files", "cv.pdf", "application/pdf", new byte[1])))
          .andExpect(status().isUnsupportedMediaType())
          .andExpect(jsonPath("$.code").value(ApiError.UNSUPPORTED_DOCUMENT))
          .andExpect(jsonPath("$.path").value("/api/candidates/upload"));
    }

    @Test
    @DisplayName("should return 415 when the unsupported part has no filename")
    void shouldReturnUnsupportedMediaType_whenFilenameMissing() throws Exception {
      when(screeningService.upload(anyList()))
          .thenThrow(new UnsupportedDocumentException(Arrays.asList((String) null)));

      mockMvc
          .perform(
              multipart("/api/candidates/upload")
                  .file(new MockMultipartFile("files", null, "image/png", new byte[1])))
          .andExpect(status().isUnsupportedMediaType())
          .andExpect(jsonPath("$.code").value(ApiError.UNSUPPORTED_DOCUMENT));
    }

    @Test
    @DisplayName("should return 413 when too many files are sent")
    void shouldReturnPayloadTooLarge() throws Exception {
      when(screeningService.upload(anyList())).thenThrow(new UploadLimitExceededException(3, 2));

      mockMvc
          .perform(
              multipart("/api/candidates/upload")
                  .file(new MockMultipartFile("files", "a.txt", "text/plain", new byte[1])))
          .andExpect(status().isPayloadTooLarge())
          .andExpect(jsonPath("$.code").value(ApiError.UPLOAD_LIMIT_EXCEEDED));
    }

    @Test
    @DisplayName("should return 409 on a duplicate identifier")
    void shouldReturnConflict() throws Exception {
      when(screeningService.ingest(anyList())).thenThrow(new DuplicateIdentifierException("x"));
      TextUploadRequest request =
          TextUploadRequest.builder().filename("cv.txt").text("python").build();

      mockMvc
          .perform(
              post("/api/candidates/text")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isConflict())
          .andExpect(jsonPath("$.code").value(ApiError.DUPLICATE_CANDIDATE))
          .andExpect(jsonPath("$.errorId").isNotEmpty());
    }

    @Test
    @DisplayName("should reject a text upload without a filename")
    void shouldRejectBlankFilename() throws Exception {
      TextUploadRequest request = TextUploadRequest.builder().filename(" ").text("python").build();

      mockMvc
          .perform(
              post("/api/candidates/text")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR))
          .andExpect(jsonPath("$.message").value(startsWith("filename")));

      verify(screeningService, never()).ingest(anyList());
    }
  }

  @Nested
  @DisplayName("Filter")
  class Filter {

    @Test
    @DisplayName("should explain an empty store instead of filtering")
    void shouldReturnMessage_whenStoreEmpty() throws Exception {
      when(screeningService.countCandidates()).thenReturn(0);

      mockMvc
          .perform(
              post("/api/candidates/filter")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(filterRequest("strict", "python"))))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.candidates").isEmpty())
          .andExpect(jsonPath("$.total").value(0))
          .andExpect(jsonPath("$.message").value(CandidateController.NO_CANDIDATES_MESSAGE));

      verify(screeningService, never()).filter(any());
    }

    @Test
    @DisplayName("should pass canonical requirements to the service")
    void shouldCanonicalizeRequirements() throws Exception {
      // Given
      RequirementSet expected =
          RequirementSet.builder()
              .requiredSkills(Set.of("python"))
              .mode(MatchingMode.RANKING)
              .build();
      ParsedProfile profile =
          ScreeningFixtures.profile("id-1", Set.of("python"), 3, EducationLevel.NONE);
      when(screeningService.countCandidates()).thenReturn(1);
      when(screeningService.filter(any())).thenReturn(List.of(screened(profile, expected)));

      // When / Then
      mockMvc
          .perform(
              post("/api/candidates/filter")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(filterRequest("Ranking", " Python3 "))))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.total").value(1))
          .andExpect(jsonPath("$.candidates[0].id").value("id-1"))
          .andExpect(jsonPath("$.candidates[0].score").value(100.0))
          .andExpect(jsonPath("$.candidates[0].passed").value(true))
          .andExpect(jsonPath("$.candidates[0].modeUsed").value("ranking"))
          .andExpect(jsonPath("$.candidates[0].skillsMatched[0]").value("python"));

      verify(screeningService)
          .filter(
              argThat(
                  requirements ->
                      requirements.mode() == MatchingMode.RANKING
                          && requirements.requiredSkills().equals(Set.of("python"))));
    }

    @Test
    @DisplayName("should reject an unknown matching mode")
    void shouldRejectUnknownMode() throws Exception {
      mockMvc
          .perform(
              post("/api/candidates/filter")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(filterRequest("fuzzy", "python"))))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.INVALID_REQUIREMENT))
          .andExpect(jsonPath("$.message").value(startsWith("mode: ")));
    }

    @Test
    @DisplayName("should reject a score threshold above 100")
    void shouldRejectScoreAboveRange() throws Exception {
      FilterRequest request = filterRequest("strict");
      request.setMinScore(120.0);

      mockMvc
          .perform(
              post("/api/candidates/filter")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.INVALID_REQUIREMENT));
    }

    @Test
    @DisplayName("should reject malformed JSON")
    void shouldRejectMalformedJson() throws Exception {
      mockMvc
          .perform(
              post("/api/candidates/filter")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"skills\": [\"python\""))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
    }
  }

  @Test
  @DisplayName("export should return a CSV attachment")
  void exportShouldReturnCsvAttachment() throws Exception {
    RequirementSet requirements = RequirementSet.unconstrained();
    ParsedProfile profile =
        ScreeningFixtures.profile("id-1", Set.of("python"), 3, EducationLevel.NONE);
    when(screeningService.filter(any())).thenReturn(List.of(screened(profile, requirements)));

    mockMvc
        .perform(
            post("/api/candidates/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(filterRequest("ranking"))))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith("text/csv"))
        .andExpect(
            header()
                .string(
                    HttpHeaders.CONTENT_DISPOSITION,
                    "attachment; filename=ats_export_20240615_000000.csv"))
        .andExpect(content().string(startsWith("id,filename,email,phone,score,passed")));
  }

  @Nested
  @DisplayName("Compare")
  class Compare {

    @Test
    @DisplayName("should return candidates in requested order")
    void shouldReturnRequestedOrder() throws Exception {
      RequirementSet requirements = RequirementSet.unconstrained();
      ParsedProfile first = ScreeningFixtures.profile("b", Set.of(), 1, EducationLevel.NONE);
      ParsedProfile second = ScreeningFixtures.profile("a", Set.of(), 1, EducationLevel.NONE);
      when(screeningService.compare(eq(List.of("b", "a")), any()))
          .thenReturn(List.of(screened(first, requirements), screened(second, requirements)));
      CompareRequest request = new CompareRequest();
      request.setIds(List.of("b", "a"));

      mockMvc
          .perform(
              post("/api/candidates/compare")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.candidates[0].id").value("b"))
          .andExpect(jsonPath("$.candidates[1].id").value("a"));
    }

    @Test
    @DisplayName("should return 400 when fewer than two candidates resolve")
    void shouldReturnBadRequest_whenInsufficient() throws Exception {
      when(screeningService.compare(anyList(), any()))
          .thenThrow(new InsufficientCandidatesException(2, 1));
      CompareRequest request = new CompareRequest();
      request.setIds(List.of("a", "ghost"));

      mockMvc
          .perform(
              post("/api/candidates/compare")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.INSUFFICIENT_CANDIDATES));
    }

    @Test
    @DisplayName("should require the ids field")
    void shouldRequireIds() throws Exception {
      mockMvc
          .perform(
              post("/api/candidates/compare")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"skills\": [\"python\"]}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
    }
  }

  @Test
  @DisplayName("list should return candidates in upload order")
  void listShouldReturnUploadOrder() throws Exception {
    when(screeningService.getCandidates())
        .thenReturn(
            List.of(
                ScreeningFixtures.profile("first", Set.of(), 0, EducationLevel.NONE),
                ScreeningFixtures.profile("second", Set.of(), 0, EducationLevel.NONE)));

    mockMvc
        .perform(get("/api/candidates"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("first"))
        .andExpect(jsonPath("$[1].id").value("second"));
  }

  @Test
  @DisplayName("clear should report removed and remaining counts")
  void clearShouldReportCounts() throws Exception {
    when(screeningService.clear()).thenReturn(3);
    when(screeningService.countCandidates()).thenReturn(0);

    mockMvc
        .perform(post("/api/candidates/clear"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.removed").value(3))
        .andExpect(jsonPath("$.totalStored").value(0));
  }
}
