package com.flamingo.ai.resumescreener.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Ordered education scale. Declaration order is the rank used for comparisons. */
public enum EducationLevel {
  /** No recognizable degree in the document. */
  NONE,

  /** Secondary school (high school, SMA/SMK). */
  HIGHSCHOOL,

  /** Diploma or associate degree. */
  DIPLOMA,

  BACHELOR,

  MASTER,

  /** PhD or other doctorate. */
  DOCTORATE;

  /** Returns the rank of this level on the scale, {@code NONE} being 0. */
  public int rank() {
    return ordinal();
  }

  public boolean isAtLeast(EducationLevel other) {
    return rank() >= other.rank();
  }

  /** Lower-case wire name, e.g. {@code bachelor}. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a level from user input. Accepts enum names case-insensitively plus the aliases
   * {@code phd} and {@code high school}.
   *
   * @param value raw level name
   * @return the level, or empty if the value is not recognized
   */
  public static Optional<EducationLevel> fromValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String key = value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
    if (key.equals("phd")) {
      return Optional.of(DOCTORATE);
    }
    for (EducationLevel level : values()) {
      if (level.name().toLowerCase(Locale.ROOT).equals(key)) {
        return Optional.of(level);
      }
    }
    return Optional.empty();
  }
}
