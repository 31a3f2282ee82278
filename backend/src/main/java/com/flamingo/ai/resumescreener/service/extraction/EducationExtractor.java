package com.flamingo.ai.resumescreener.service.extraction;

import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;
import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Detects degree levels mentioned in normalized text using the education vocabulary. */
@Component
@RequiredArgsConstructor
public class EducationExtractor {

  /**
   * Phrases that contain a degree variant without naming a degree: job titles ("scrum master"),
   * technical terms ("master data", "master branch"), product names ("ms office", "aws s3") and the
   * "ms." salutation. They are blanked out before matching.
   */
  private static final Pattern NON_DEGREE_PHRASES =
      Pattern.compile(
          "(?<![\\p{L}\\p{N}])(?:"
              + "(?:certified scrum|scrum|product|quiz|web|head|band|grand|toast) master"
              + "|master (?:data|branch|class|plan|key|node|record|copy|file|list)"
              + "|ms (?:office|excel|word|powerpoint|outlook|access|project|teams|visio|sql"
              + "|azure|dynamics)"
              + "|ms\\.(?=\\s)"
              + "|(?:aws|amazon) s3|s3 buckets?"
              + ")(?![\\p{L}\\p{N}])");

  private final VocabularyIndex vocabularyIndex;

  /**
   * Returns the highest level mentioned, so listing an extra higher degree can only raise it.
   *
   * @param text normalized text
   * @return highest level found, {@link EducationLevel#NONE} if none
   */
  public EducationLevel highestLevel(String text) {
    return vocabularyIndex.education().findAll(withoutNonDegreePhrases(text)).stream()
        .max(Comparator.comparingInt(EducationLevel::rank))
        .orElse(EducationLevel.NONE);
  }

  /**
   * Returns the lowest level mentioned. Job descriptions usually list acceptable alternatives
   * ("bachelor or master"), and the lowest one is the real floor.
   */
  public Optional<EducationLevel> lowestLevel(String text) {
    return vocabularyIndex.education().findAll(withoutNonDegreePhrases(text)).stream()
        .min(Comparator.comparingInt(EducationLevel::rank));
  }

  private static String withoutNonDegreePhrases(String text) {
    return NON_DEGREE_PHRASES.matcher(text).replaceAll(" ");
  }
}
