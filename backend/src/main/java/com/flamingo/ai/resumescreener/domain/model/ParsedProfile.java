package com.flamingo.ai.resumescreener.domain.model;

import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;

/**
 * Structured facts extracted from one candidate document. Instances are immutable; collections are
 * defensively copied and keep first-seen order.
 *
 * @param id opaque URL-safe identifier assigned at parse time
 * @param filename original document name
 * @param rawText canonical normalized text the facts were extracted from
 * @param emails distinct email-like strings in order of first occurrence
 * @param phones distinct phone-like strings in order of first occurrence
 * @param totalExperienceYears cumulative experience from merged date ranges, 0 if none found
 * @param educationFoundLevel highest education level detected, {@link EducationLevel#NONE} if none
 * @param skills canonical skill tokens found in the text
 * @param keywords canonical keyword tokens found in the text
 * @param uploadedAt time the profile was parsed
 */
@Builder(toBuilder = true)
public record ParsedProfile(
    String id,
    String filename,
    String rawText,
    List<String> emails,
    List<String> phones,
    double totalExperienceYears,
    EducationLevel educationFoundLevel,
    Set<String> skills,
    Set<String> keywords,
    Instant uploadedAt) {

  public ParsedProfile {
    rawText = rawText == null ? "" : rawText;
    emails = emails == null ? List.of() : List.copyOf(emails);
    phones = phones == null ? List.of() : List.copyOf(phones);
    totalExperienceYears = Math.max(0.0, totalExperienceYears);
    educationFoundLevel = educationFoundLevel == null ? EducationLevel.NONE : educationFoundLevel;
    skills = orderedCopy(skills);
    keywords = orderedCopy(keywords);
  }

  /**
   * Returns the {@code {id}_{filename}} key a file-serving collaborator can use. Characters outside
   * {@code [A-Za-z0-9._-]} are replaced by underscores so the key is URL-safe.
   */
  public String storedFileName() {
    String name = filename == null || filename.isBlank() ? "document" : filename;
    return (id + "_" + name).replaceAll("[^A-Za-z0-9._-]", "_");
  }

  /** Returns a copy of this profile under a different identifier. */
  public ParsedProfile withId(String newId) {
    return toBuilder().id(newId).build();
  }

  private static Set<String> orderedCopy(Set<String> source) {
    if (source == null || source.isEmpty()) {
      return Set.of();
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(source));
  }
}
