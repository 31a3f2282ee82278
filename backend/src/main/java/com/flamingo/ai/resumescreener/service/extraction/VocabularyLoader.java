package com.flamingo.ai.resumescreener.service.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.resumescreener.domain.enums.EducationLevel;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Reads a {@link VocabularyDictionary} from a JSON resource of the form:
 *
 * <pre>{@code
 * {
 *   "skills":    { "node.js": ["nodejs", "node js"], ... },
 *   "keywords":  { "leadership": ["led a team"], ... },
 *   "education": { "bachelor": ["bachelor", "b.sc"], ... }
 * }
 * }</pre>
 *
 * <p>Tokens and variants are lower-cased. Education keys must name an {@link EducationLevel}.
 */
@RequiredArgsConstructor
@Slf4j
public class VocabularyLoader {

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;

  /** Raw shape of the vocabulary file. */
  public record VocabularyFile(
      Map<String, List<String>> skills,
      Map<String, List<String>> keywords,
      Map<String, List<String>> education) {}

  /**
   * Loads the vocabulary at the given location.
   *
   * @param location Spring resource location, e.g. {@code classpath:vocabulary/x.json}
   * @return the parsed dictionary
   * @throws IllegalStateException if the resource is missing or names an unknown education level
   */
  public VocabularyDictionary load(String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new IllegalStateException("Vocabulary resource not found: " + location);
    }

    VocabularyFile file;
    try (InputStream in = resource.getInputStream()) {
      file = objectMapper.readValue(in, VocabularyFile.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read vocabulary from " + location, e);
    }

    VocabularyDictionary dictionary =
        new VocabularyDictionary(
            lowerCased(file.skills()),
            lowerCased(file.keywords()),
            educationTable(file.education()));

    log.info(
        "Loaded vocabulary from {}: {} skills, {} keywords, {} education levels",
        location,
        dictionary.getSkills().size(),
        dictionary.getKeywords().size(),
        dictionary.getEducation().size());
    return dictionary;
  }

  private Map<String, List<String>> lowerCased(Map<String, List<String>> table) {
    Map<String, List<String>> result = new LinkedHashMap<>();
    if (table == null) {
      return result;
    }
    table.forEach(
        (token, variants) ->
            result.put(
                VocabularyMatcher.clean(token),
                variants == null
                    ? List.of()
                    : variants.stream().map(VocabularyMatcher::clean).toList()));
    return result;
  }

  private Map<EducationLevel, List<String>> educationTable(Map<String, List<String>> table) {
    Map<EducationLevel, List<String>> result = new EnumMap<>(EducationLevel.class);
    lowerCased(table)
        .forEach(
            (name, variants) -> {
              EducationLevel level =
                  EducationLevel.fromValue(name)
                      .orElseThrow(
                          () ->
                              new IllegalStateException(
                                  "Unknown education level in vocabulary: "
                                      + name.toUpperCase(Locale.ROOT)));
              result.put(level, variants);
            });
    return result;
  }
}
