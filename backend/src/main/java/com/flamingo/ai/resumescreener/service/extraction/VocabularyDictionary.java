package com.flamingo.ai.resumescreener.service.extraction;

import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup tables of {@code canonical token -> match variants} for skills, keywords and education
 * levels. Matching logic lives in {@link VocabularyMatcher}; this class only carries the content.
 */
public final class VocabularyDictionary {

  private final Map<String, List<String>> skills;
  private final Map<String, List<String>> keywords;
  private final Map<EducationLevel, List<String>> education;

  public VocabularyDictionary(
      Map<String, List<String>> skills,
      Map<String, List<String>> keywords,
      Map<EducationLevel, List<String>> education) {
    this.skills = Collections.unmodifiableMap(new LinkedHashMap<>(skills));
    this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    EnumMap<EducationLevel, List<String>> levels = new EnumMap<>(EducationLevel.class);
    levels.putAll(education);
    this.education = Collections.unmodifiableMap(levels);
  }

  public Map<String, List<String>> getSkills() {
    return skills;
  }

  public Map<String, List<String>> getKeywords() {
    return keywords;
  }

  public Map<EducationLevel, List<String>> getEducation() {
    return education;
  }
}
