package com.flamingo.ai.resumescreener.service.extraction;

import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;

/** Compiled matchers for every vocabulary category, built once from a dictionary. */
public class VocabularyIndex {

  private final VocabularyMatcher<String> skills;
  private final VocabularyMatcher<String> keywords;
  private final VocabularyMatcher<EducationLevel> education;

  public VocabularyIndex(VocabularyDictionary dictionary) {
    this.skills = VocabularyMatcher.forTokens(dictionary.getSkills());
    this.keywords = VocabularyMatcher.forTokens(dictionary.getKeywords());
    // Level names like "master" are too ambiguous to match on their own; only listed variants count
    this.education = VocabularyMatcher.compile(dictionary.getEducation(), null);
  }

  public VocabularyMatcher<String> skills() {
    return skills;
  }

  public VocabularyMatcher<String> keywords() {
    return keywords;
  }

  public VocabularyMatcher<EducationLevel> education() {
    return education;
  }
}
