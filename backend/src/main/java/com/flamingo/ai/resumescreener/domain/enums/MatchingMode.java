package com.flamingo.ai.resumescreener.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Decision policy applied on top of the match score. */
public enum MatchingMode {
  /** Hard gate: every skill, the experience floor, the education floor and the score must pass. */
  STRICT,

  /** Score-only gate: candidates are ranked and only the score threshold can reject. */
  RANKING;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<MatchingMode> fromValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String key = value.trim().toUpperCase(Locale.ROOT);
    for (MatchingMode mode : values()) {
      if (mode.name().equals(key)) {
        return Optional.of(mode);
      }
    }
    return Optional.empty();
  }
}
