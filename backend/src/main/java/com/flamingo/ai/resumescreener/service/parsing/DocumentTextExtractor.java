package com.flamingo.ai.resumescreener.service.parsing;

/**
 * Decodes an uploaded document into plain text for fact extraction.
 *
 * <p>Implementations are format-specific and stateless so one instance can be shared across the
 * extraction pool. Binary formats (PDF, DOCX) are decoded outside this service and submitted as
 * text.
 */
public interface DocumentTextExtractor {

  /**
   * Returns {@code true} if this extractor can decode the document.
   *
   * @param filename original file name, may be {@code null}
   * @param contentType declared MIME type, may be {@code null}
   * @return {@code true} if supported
   */
  boolean supports(String filename, String contentType);

  /**
   * Decodes the document bytes.
   *
   * @param filename original file name, used for error reporting
   * @param content raw document bytes
   * @return the document text, never {@code null}
   * @throws com.flamingo.ai.resumescreener.exception.DocumentProcessingException if the content
   *     cannot be decoded
   */
  String extractText(String filename, byte[] content);
}
