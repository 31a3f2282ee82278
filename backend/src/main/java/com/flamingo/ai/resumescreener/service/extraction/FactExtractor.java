package com.flamingo.ai.resumescreener.service.extraction;

import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;
import com.flamingo.ai.resumescreener.domain.model.ParsedProfile;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns normalized resume text into a {@link ParsedProfile}.
 *
 * <p>Each fact is extracted independently. A sub-extractor that finds nothing, or fails on a
 * malformed section, leaves its field at the default (empty list, 0 years, {@link
 * EducationLevel#NONE}) and the rest of the profile is still produced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FactExtractor {

  private final ContactExtractor contactExtractor;
  private final ExperienceExtractor experienceExtractor;
  private final EducationExtractor educationExtractor;
  private final VocabularyIndex vocabularyIndex;
  private final Clock clock;

  /**
   * Extracts a profile.
   *
   * @param id identifier assigned by the caller
   * @param filename original document name
   * @param normalizedText output of {@link TextNormalizer#normalize(String)}
   * @return the extracted profile, never {@code null}
   */
  public ParsedProfile extract(String id, String filename, String normalizedText) {
    String text = normalizedText == null ? "" : normalizedText;

    List<String> emails =
        extractField(filename, "emails", () -> contactExtractor.extractEmails(text), List.of());
    List<String> phones =
        extractField(filename, "phones", () -> contactExtractor.extractPhones(text), List.of());
    double years =
        extractField(filename, "experience", () -> experienceExtractor.extractYears(text), 0.0);
    EducationLevel education =
        extractField(
            filename,
            "education",
            () -> educationExtractor.highestLevel(text),
            EducationLevel.NONE);
    Set<String> skills =
        extractField(filename, "skills", () -> vocabularyIndex.skills().findAll(text), Set.of());
    Set<String> keywords =
        extractField(
            filename, "keywords", () -> vocabularyIndex.keywords().findAll(text), Set.of());

    if (years == 0.0) {
      log.debug("Extraction degraded for {}: no date ranges found", filename);
    }
    if (education == EducationLevel.NONE) {
      log.debug("Extraction degraded for {}: no education level found", filename);
    }

    ParsedProfile profile =
        ParsedProfile.builder()
            .id(id)
            .filename(filename)
            .rawText(text)
            .emails(emails)
            .phones(phones)
            .totalExperienceYears(years)
            .educationFoundLevel(education)
            .skills(skills)
            .keywords(keywords)
            .uploadedAt(Instant.now(clock))
            .build();

    log.debug(
        "Extracted profile {} ({}): {} skills, {} keywords, {} years, education={}",
        id,
        filename,
        skills.size(),
        keywords.size(),
        years,
        education);
    return profile;
  }

  private <T> T extractField(String filename, String field, Supplier<T> extraction, T fallback) {
    T value;
    try {
      value = extraction.get();
    } catch (RuntimeException e) {
      log.warn(
          "Extraction of {} failed for {}, using default: {}", field, filename, e.getMessage());
      return fallback;
    }
    if (value == null) {
      return fallback;
    }
    if (value instanceof Collection<?> collection && collection.isEmpty()) {
      log.debug("Extraction degraded for {}: no {} found", filename, field);
    }
    return value;
  }
}
