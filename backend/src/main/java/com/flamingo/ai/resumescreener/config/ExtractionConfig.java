package com.flamingo.ai.resumescreener.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.resumescreener.service.extraction.VocabularyDictionary;
import com.flamingo.ai.resumescreener.service.extraction.VocabularyIndex;
import com.flamingo.ai.resumescreener.service.extraction.VocabularyLoader;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/** Wires the vocabulary and the clock used by the extractors. */
@Configuration
public class ExtractionConfig {

  @Bean
  public VocabularyLoader vocabularyLoader(
      ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    return new VocabularyLoader(resourceLoader, objectMapper);
  }

  @Bean
  public VocabularyDictionary vocabularyDictionary(
      VocabularyLoader vocabularyLoader, ScreeningConfig screeningConfig) {
    return vocabularyLoader.load(screeningConfig.getVocabulary().getLocation());
  }

  @Bean
  public VocabularyIndex vocabularyIndex(VocabularyDictionary vocabularyDictionary) {
    return new VocabularyIndex(vocabularyDictionary);
  }

  /** Resolves "present" in date ranges; replaced with a fixed clock in tests. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
