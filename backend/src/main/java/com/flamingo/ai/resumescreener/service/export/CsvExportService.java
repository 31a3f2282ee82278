package com.flamingo.ai.resumescreener.service.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flamingo.ai.resumescreener.domain.model.MatchResult;
import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import com.flamingo.ai.resumescreener.domain.model.ScreenedCandidate;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Renders screened candidates as a recruiter shortlist in CSV. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CsvExportService {

  static final String MULTI_VALUE_SEPARATOR = ";";

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private static final CsvMapper CSV_MAPPER = new CsvMapper();
  private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(CsvRow.class).withHeader();

  private final Clock clock;

  /** One exported line. Multi-valued cells are joined with {@code ;}. */
  @JsonPropertyOrder({
    "id",
    "filename",
    "email",
    "phone",
    "score",
    "passed",
    "skills_required",
    "skills_matched",
    "skills_missing",
    "experience_years",
    "education_found_level",
    "keywords_required",
    "keywords_matched",
    "reject_reasons"
  })
  record CsvRow(
      @JsonProperty("id") String id,
      @JsonProperty("filename") String filename,
      @JsonProperty("email") String email,
      @JsonProperty("phone") String phone,
      @JsonProperty("score") double score,
      @JsonProperty("passed") boolean passed,
      @JsonProperty("skills_required") String skillsRequired,
      @JsonProperty("skills_matched") String skillsMatched,
      @JsonProperty("skills_missing") String skillsMissing,
      @JsonProperty("experience_years") double experienceYears,
      @JsonProperty("education_found_level") String educationFoundLevel,
      @JsonProperty("keywords_required") String keywordsRequired,
      @JsonProperty("keywords_matched") String keywordsMatched,
      @JsonProperty("reject_reasons") String rejectReasons) {}

  /**
   * Writes the candidates, header first, in the given order.
   *
   * @param candidates screened candidates
   * @return CSV document text
   */
  public String export(List<ScreenedCandidate> candidates) {
    List<CsvRow> rows = candidates.stream().map(CsvExportService::toRow).toList();
    if (rows.isEmpty()) {
      // The CSV generator only emits the header together with the first row
      return headerLine();
    }
    try {
      String csv = CSV_MAPPER.writer(SCHEMA).writeValueAsString(rows);
      log.info("Exported {} candidates to CSV", rows.size());
      return csv;
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to write CSV export", e);
    }
  }

  /** Returns the download name, {@code ats_export_<yyyyMMdd_HHmmss>.csv} in UTC. */
  public String exportFileName() {
    return "ats_export_" + FILE_TIMESTAMP.format(clock.instant()) + ".csv";
  }

  private static String headerLine() {
    List<String> names = new ArrayList<>();
    SCHEMA.forEach(column -> names.add(column.getName()));
    return String.join(",", names) + new String(SCHEMA.getLineSeparator());
  }

  private static CsvRow toRow(ScreenedCandidate candidate) {
    ParsedProfile profile = candidate.profile();
    MatchResult result = candidate.result();
    return new CsvRow(
        profile.id(),
        profile.filename(),
        join(profile.emails()),
        join(profile.phones()),
        result.score(),
        result.passed(),
        join(candidate.requirements().requiredSkills()),
        join(result.skillsMatched()),
        join(result.skillsMissing()),
        profile.totalExperienceYears(),
        profile.educationFoundLevel().wireName(),
        join(candidate.requirements().requiredKeywords()),
        join(result.keywordsMatched()),
        join(result.rejectReasons()));
  }

  private static String join(Collection<String> values) {
    return String.join(MULTI_VALUE_SEPARATOR, values);
  }
}
