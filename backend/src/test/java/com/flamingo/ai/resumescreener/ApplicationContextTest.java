package com.flamingo.ai.resumescreener;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.resumescreener.service.export.CsvExportService;
import com.flamingo.ai.resumescreener.service.extraction.VocabularyIndex;
import com.flamingo.ai.resumescreener.service.parsing.DocumentTextExtractor;
import com.flamingo.ai.resumescreener.service.parsing.MarkdownDocumentExtractor;
import com.flamingo.ai.resumescreener.service.parsing.PlainTextDocumentExtractor;
import com.flamingo.ai.resumescreener.service.screening.ScreeningService;
import com.flamingo.ai.resumescreener.service.store.CandidateStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies the Spring application context loads with the bundled vocabulary. */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Autowired private List<DocumentTextExtractor> documentTextExtractors;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ScreeningService.class)).isNotNull();
    assertThat(applicationContext.getBean(CandidateStore.class)).isNotNull();
    assertThat(applicationContext.getBean(CsvExportService.class)).isNotNull();
  }

  @Test
  @DisplayName("Bundled vocabulary should be loaded")
  void vocabularyShouldBeLoaded() {
    VocabularyIndex index = applicationContext.getBean(VocabularyIndex.class);
    assertThat(index.skills().isKnown("python")).isTrue();
    assertThat(index.education().size()).isEqualTo(5);
  }

  @Test
  @DisplayName("Store and extraction pool gauges should be registered")
  void screeningGaugesShouldBeRegistered() {
    MeterRegistry registry = applicationContext.getBean(MeterRegistry.class);

    assertThat(registry.find("candidate.store.size").gauge()).isNotNull();
    assertThat(registry.find("extraction.pool.active").gauge()).isNotNull();
    assertThat(registry.find("extraction.pool.queued").gauge()).isNotNull();
  }

  @Test
  @DisplayName("Markdown extractor should be consulted before plain text")
  void extractorsShouldBeOrdered() {
    assertThat(documentTextExtractors)
        .extracting(Object::getClass)
        .containsExactly(MarkdownDocumentExtractor.class, PlainTextDocumentExtractor.class);
  }
}
