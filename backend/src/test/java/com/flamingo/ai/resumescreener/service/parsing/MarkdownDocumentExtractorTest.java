package com.flamingo.ai.resumescreener.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MarkdownDocumentExtractor Tests")
class MarkdownDocumentExtractorTest {

  private final MarkdownDocumentExtractor extractor =
      new MarkdownDocumentExtractor(new PlainTextDocumentExtractor());

  @Test
  @DisplayName("should recognise Markdown files")
  void shouldRecogniseMarkdown() {
    assertThat(extractor.supports("resume.md", null)).isTrue();
    assertThat(extractor.supports("resume.MARKDOWN", null)).isTrue();
    assertThat(extractor.supports("upload", "text/markdown")).isTrue();
    assertThat(extractor.supports("resume.txt", "text/plain")).isFalse();
  }

  @Test
  @DisplayName("should strip headings, emphasis and links")
  void shouldStripMarkup() {
    String markdown =
        """
        # Jane Doe

        ## Experience

        Built **Spring Boot** services, see [portfolio](https://example.com).
        """;

    String text = extractor.extractText("cv.md", markdown.getBytes(StandardCharsets.UTF_8));

    assertThat(text)
        .contains("Jane Doe", "Experience", "Built Spring Boot services")
        .doesNotContain("#", "**", "[portfolio]");
  }

  @Test
  @DisplayName("should keep block boundaries as line breaks")
  void shouldKeepBlocksOnSeparateLines() {
    String text =
        extractor.extractText(
            "cv.md", "# Skills\n\nJava\n\nJan 2019 - Mar 2021\n".getBytes(StandardCharsets.UTF_8));

    assertThat(text.lines().map(String::strip).filter(line -> !line.isEmpty()))
        .containsExactly("Skills", "Java", "Jan 2019 - Mar 2021");
  }
}
