package com.flamingo.ai.resumescreener.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.resumescreener.ScreeningFixtures;
import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("EducationExtractor Tests")
class EducationExtractorTest {

  private final EducationExtractor extractor =
      new EducationExtractor(ScreeningFixtures.vocabularyIndex());

  @ParameterizedTest(name = "\"{0}\" -> {1}")
  @CsvSource(
      delimiter = '|',
      value = {
        "sma negeri 1 jakarta | HIGHSCHOOL",
        "associate degree in accounting | DIPLOMA",
        "bachelor of computer science | BACHELOR",
        "m.sc. data science | MASTER",
        "master in computer science, 2018 | MASTER",
        "master, informatics | MASTER",
        "ms in computer science | MASTER",
        "s2 teknik informatika | MASTER",
        "s1 sistem informasi | BACHELOR",
        "s3 ilmu komputer | DOCTORATE",
        "ph.d. in physics | DOCTORATE",
        "self-taught developer | NONE"
      })
  @DisplayName("should detect the level of a single degree")
  void shouldDetectSingleLevel(String text, EducationLevel expected) {
    assertThat(extractor.highestLevel(text)).isEqualTo(expected);
  }

  @Test
  @DisplayName("should pick the highest level when several are listed")
  void shouldPickHighestLevel() {
    String text = "high school diploma\nbachelor of science\nmaster of science";

    assertThat(extractor.highestLevel(text)).isEqualTo(EducationLevel.MASTER);
  }

  @Test
  @DisplayName("should never lower the level when a degree is added")
  void shouldBeMonotonic_whenDegreeAdded() {
    String base = "bachelor of engineering, 2015";
    EducationLevel before = extractor.highestLevel(base);

    for (String extra : new String[] {"high school", "diploma", "mba", "phd"}) {
      EducationLevel after = extractor.highestLevel(base + "\n" + extra);
      assertThat(after.rank()).as("adding %s", extra).isGreaterThanOrEqualTo(before.rank());
    }
  }

  @Test
  @DisplayName("should not read 'master' in unrelated words as a degree")
  void shouldIgnoreMasterInOtherWords() {
    assertThat(extractor.highestLevel("scrum master, mastered kotlin"))
        .isEqualTo(EducationLevel.NONE);
  }

  @ParameterizedTest(name = "\"{0}\"")
  @CsvSource(
      delimiter = '|',
      value = {
        "certified scrum master",
        "maintained master data for sap",
        "merged feature work into the master branch",
        "ms office, ms excel",
        "ms. jane doe",
        "stored reports in aws s3 buckets"
      })
  @DisplayName("should ignore phrases that only look like degrees")
  void shouldIgnoreNonDegreePhrases(String text) {
    assertThat(extractor.highestLevel(text)).isEqualTo(EducationLevel.NONE);
  }

  @Test
  @DisplayName("should still detect a degree next to an ignored phrase")
  void shouldDetectDegreeNextToIgnoredPhrase() {
    assertThat(extractor.highestLevel("scrum master\nmaster of business administration"))
        .isEqualTo(EducationLevel.MASTER);
  }

  @Test
  @DisplayName("lowestLevel should return the floor of listed alternatives")
  void lowestLevelShouldReturnFloor() {
    assertThat(extractor.lowestLevel("bachelor or master's degree in cs"))
        .contains(EducationLevel.BACHELOR);
    assertThat(extractor.lowestLevel("no degree required")).isEmpty();
  }
}
