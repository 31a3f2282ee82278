package com.flamingo.ai.resumescreener.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.resumescreener.exception.DocumentProcessingException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("PlainTextDocumentExtractor Tests")
class PlainTextDocumentExtractorTest {

  private final PlainTextDocumentExtractor extractor = new PlainTextDocumentExtractor();

  @ParameterizedTest(name = "{0} / {1} -> {2}")
  @CsvSource({
    "cv.txt, application/octet-stream, true",
    "CV.TXT, , true",
    "notes.text, , true",
    "upload, text/plain; charset=UTF-8, true",
    "cv.pdf, application/pdf, false",
    "cv.md, text/markdown, false",
    ", , false"
  })
  @DisplayName("should recognise plain text by extension or content type")
  void shouldRecognisePlainText(String filename, String contentType, boolean expected) {
    assertThat(extractor.supports(filename, contentType)).isEqualTo(expected);
  }

  @Test
  @DisplayName("should decode UTF-8 text")
  void shouldDecodeUtf8() {
    byte[] content = "José Müller\nPython".getBytes(StandardCharsets.UTF_8);

    assertThat(extractor.extractText("cv.txt", content)).isEqualTo("José Müller\nPython");
  }

  @Test
  @DisplayName("should reject bytes that are not valid UTF-8")
  void shouldRejectInvalidUtf8() {
    byte[] content = {'c', 'v', (byte) 0xC3, (byte) 0x28};

    assertThatThrownBy(() -> extractor.extractText("cv.txt", content))
        .isInstanceOf(DocumentProcessingException.class)
        .satisfies(
            e -> assertThat(((DocumentProcessingException) e).getFileName()).isEqualTo("cv.txt"));
  }
}
