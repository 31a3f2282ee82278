package com.flamingo.ai.resumescreener.service.extraction;

import com.flamingo.ai.resumescreener.domain.enums.MatchingMode;
import com.flamingo.ai.resumescreener.domain.model.RequirementSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Derives default screening criteria from a job description, for the recruiter to review and edit
 * before filtering.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequirementExtractor {

  private static final Pattern MIN_YEARS = Pattern.compile("(\\d+)\\s*\\+?\\s*(?:years?|yrs?)\\b");

  private final TextNormalizer textNormalizer;
  private final EducationExtractor educationExtractor;
  private final VocabularyIndex vocabularyIndex;

  /**
   * Extracts a requirement set from raw job-description text.
   *
   * @param jobDescription decoded JD text
   * @return strict-mode requirements with detected skills, keywords, experience and education
   */
  public RequirementSet extract(String jobDescription) {
    String text = textNormalizer.normalize(jobDescription);

    Matcher years = MIN_YEARS.matcher(text);
    Double minExperience = years.find() ? Double.valueOf(years.group(1)) : null;

    RequirementSet requirements =
        RequirementSet.builder()
            .requiredSkills(vocabularyIndex.skills().findAll(text))
            .requiredKeywords(vocabularyIndex.keywords().findAll(text))
            .minExperienceYears(minExperience)
            .minEducationLevel(educationExtractor.lowestLevel(text).orElse(null))
            .mode(MatchingMode.STRICT)
            .build();

    log.info(
        "Derived JD requirements: {} skills, {} keywords, minExperience={}, education={}",
        requirements.requiredSkills().size(),
        requirements.requiredKeywords().size(),
        requirements.minExperienceYears(),
        requirements.minEducationLevel());
    return requirements;
  }
}
